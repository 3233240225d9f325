package com.example.mediahooks.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Delivery counters, exposed through the actuator metrics endpoint as
 * {@code webhook.deliveries}.
 */
@Component
@RequiredArgsConstructor
public class WebhookDeliveryMetrics {

    public static final String DELIVERIES = "webhook.deliveries";

    public static final String PATH_CHAT = "chat";
    public static final String PATH_GENERIC = "generic";
    public static final String PATH_NONE = "none";

    private final MeterRegistry meterRegistry;

    public void delivered(String path) {
        counter(path, "delivered").increment();
    }

    public void failed(String path) {
        counter(path, "failed").increment();
    }

    private Counter counter(String path, String outcome) {
        return Counter.builder(DELIVERIES)
                .description("Outbound webhook deliveries by path and outcome")
                .tag("path", path)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
