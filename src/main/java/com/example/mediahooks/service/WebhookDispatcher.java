package com.example.mediahooks.service;

import com.example.mediahooks.http.WebhookHttpClient;
import com.example.mediahooks.http.WebhookHttpRequest;
import com.example.mediahooks.http.WebhookHttpResponse;
import com.example.mediahooks.metrics.WebhookDeliveryMetrics;
import com.example.mediahooks.model.ResolvedWebhook;
import com.example.mediahooks.template.TemplateCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Webhook 投递引擎：解析匹配的 webhook，并发投递，单个失败互不影响。
 * <p>
 * Two delivery paths exist. Chat webhooks (URL containing the configured
 * marker, Discord by default) receive their stored payload untouched with a
 * fixed JSON content type. Every other webhook gets its payload compiled
 * against the event data and is sent with its own headers.
 * <p>
 * A delivery counts as done once the HTTP call returns, whatever the status
 * code, unless {@code app.webhook.delivery.fail-on-error-status} is set. Only
 * done deliveries update {@code lastTriggered}. Nothing is retried.
 */
@Service
@Slf4j
public class WebhookDispatcher {

    static final String CONTENT_TYPE = "Content-Type";
    static final String APPLICATION_JSON = "application/json";

    private static final int MAX_LOGGED_BODY = 500;

    private final WebhookRegistry registry;
    private final TemplateCompiler templateCompiler;
    private final WebhookHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor webhookExecutor;
    private final Clock clock;
    private final WebhookDeliveryMetrics metrics;
    private final String chatUrlMarker;
    private final boolean failOnErrorStatus;

    public WebhookDispatcher(WebhookRegistry registry,
            TemplateCompiler templateCompiler,
            WebhookHttpClient httpClient,
            ObjectMapper objectMapper,
            @Qualifier("webhookExecutor") Executor webhookExecutor,
            Clock clock,
            WebhookDeliveryMetrics metrics,
            @Value("${app.webhook.chat.url-marker:discord.com/api/webhooks}") String chatUrlMarker,
            @Value("${app.webhook.delivery.fail-on-error-status:false}") boolean failOnErrorStatus) {
        this.registry = registry;
        this.templateCompiler = templateCompiler;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhookExecutor = webhookExecutor;
        this.clock = clock;
        this.metrics = metrics;
        this.chatUrlMarker = chatUrlMarker;
        this.failOnErrorStatus = failOnErrorStatus;
    }

    /**
     * Delivers {@code eventType} to every enabled webhook registered for it and
     * waits until all deliveries have settled.
     *
     * @return {@code false} only when the webhooks could not be resolved;
     *         individual delivery failures are logged, not reported
     */
    public boolean triggerEventWebhooks(String eventType, Map<String, Object> data) {
        List<ResolvedWebhook> webhooks;
        JsonNode context;
        try {
            webhooks = registry.webhooksForEvent(eventType);
            if (webhooks.isEmpty()) {
                log.info("[Webhook] No webhooks registered for event: {}", eventType);
                return true;
            }
            context = enrich(eventType, data);
        } catch (Exception e) {
            log.error("[Webhook] Error triggering webhooks for event {}: {}", eventType, e.getMessage(), e);
            return false;
        }

        log.info("[Webhook] Triggering {} webhooks for event: {}", webhooks.size(), eventType);

        List<CompletableFuture<Boolean>> deliveries = webhooks.stream()
                .map(webhook -> launch(webhook, context))
                .toList();
        CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();

        long delivered = deliveries.stream().filter(CompletableFuture::join).count();
        log.info("[Webhook] Event {} dispatched: {}/{} delivered", eventType, delivered, webhooks.size());
        return true;
    }

    /**
     * Delivers a single webhook. Never throws.
     *
     * @param data template root, already enriched
     * @return whether the HTTP call completed
     */
    public boolean executeWebhook(ResolvedWebhook webhook, JsonNode data) {
        if (webhook.hasConfigurationError()) {
            log.error("[Webhook] Skipping webhook {} ({}): invalid configuration: {}",
                    webhook.getId(), webhook.getName(), webhook.getConfigurationError());
            metrics.failed(WebhookDeliveryMetrics.PATH_NONE);
            return false;
        }

        if (isChatWebhook(webhook.getUrl())) {
            log.info("[Webhook] Discord webhook detected: {}", webhook.getName());
            return deliverChatPayload(webhook, webhook.getPayload());
        }

        JsonNode body;
        try {
            body = templateCompiler.compile(webhook.getPayload(), data);
        } catch (RuntimeException e) {
            log.error("[Webhook] Failed to compile payload of webhook {}: {}", webhook.getName(), e.getMessage(), e);
            metrics.failed(WebhookDeliveryMetrics.PATH_GENERIC);
            return false;
        }

        Map<String, String> headers = new LinkedHashMap<>(webhook.getHeaders());
        if (headers.keySet().stream().noneMatch(CONTENT_TYPE::equalsIgnoreCase)) {
            headers.put(CONTENT_TYPE, APPLICATION_JSON);
        }
        return send(webhook, headers, body, WebhookDeliveryMetrics.PATH_GENERIC);
    }

    /**
     * Sends {@code payload} as-is with only a JSON content type header, using
     * the webhook's method.
     */
    public boolean deliverChatPayload(ResolvedWebhook webhook, JsonNode payload) {
        return send(webhook, Map.of(CONTENT_TYPE, APPLICATION_JSON), payload, WebhookDeliveryMetrics.PATH_CHAT);
    }

    public boolean isChatWebhook(String url) {
        return url != null && url.contains(chatUrlMarker);
    }

    private CompletableFuture<Boolean> launch(ResolvedWebhook webhook, JsonNode context) {
        try {
            return CompletableFuture.supplyAsync(() -> executeWebhook(webhook, context), webhookExecutor)
                    .exceptionally(ex -> {
                        log.error("[Webhook] Delivery of webhook {} aborted: {}", webhook.getName(), ex.getMessage(), ex);
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            log.error("[Webhook] Delivery pool rejected webhook {}: {}", webhook.getName(), e.getMessage());
            metrics.failed(WebhookDeliveryMetrics.PATH_NONE);
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean send(ResolvedWebhook webhook, Map<String, String> headers, JsonNode payload, String path) {
        WebhookHttpResponse response;
        try {
            WebhookHttpRequest request = WebhookHttpRequest.builder()
                    .method(webhook.getMethod())
                    .url(webhook.getUrl())
                    .headers(headers)
                    .body(objectMapper.writeValueAsString(payload))
                    .build();
            response = httpClient.send(request);
        } catch (Exception e) {
            log.error("[Webhook] Error triggering webhook {}: {}", webhook.getName(), e.getMessage());
            metrics.failed(path);
            return false;
        }

        if (response.isSuccessful()) {
            log.info("[Webhook] Webhook {} sent successfully (HTTP {})", webhook.getName(), response.statusCode());
        } else {
            log.warn("[Webhook] Webhook {} answered HTTP {}: {}", webhook.getName(), response.statusCode(),
                    abbreviate(response.body()));
            if (failOnErrorStatus) {
                metrics.failed(path);
                return false;
            }
        }

        registry.recordDelivery(webhook.getId());
        metrics.delivered(path);
        return true;
    }

    /**
     * Event data plus {@code event} and {@code triggeredAt}. The raw event data
     * is also reachable under {@code data} unless the event already uses that key.
     */
    JsonNode enrich(String eventType, Map<String, Object> data) {
        ObjectNode eventData = data == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(data);
        ObjectNode context = eventData.deepCopy();
        context.put("event", eventType);
        context.put("triggeredAt", clock.instant().truncatedTo(ChronoUnit.MILLIS).toString());
        if (!eventData.has("data")) {
            context.set("data", eventData);
        }
        return context;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
