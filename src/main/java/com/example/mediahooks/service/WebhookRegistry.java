package com.example.mediahooks.service;

import com.example.mediahooks.model.ResolvedWebhook;
import com.example.mediahooks.model.TriggerType;
import com.example.mediahooks.model.Webhook;
import com.example.mediahooks.repository.WebhookRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Webhook 查询网关：只返回启用的 webhook，并在加载时一次性解析 headers/payload。
 * <p>
 * Query failures propagate. {@link #recordDelivery(Long)} logs and swallows
 * its own errors.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistry {

    public static final String DEFAULT_METHOD = "POST";

    private final WebhookRepository webhookRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public List<ResolvedWebhook> webhooksForEvent(String eventType) {
        return webhookRepository.findByTriggerTypeAndEventTypeAndEnabledTrue(TriggerType.EVENT, eventType)
                .stream()
                .map(this::resolve)
                .toList();
    }

    public List<ResolvedWebhook> scheduledWebhooks() {
        return webhookRepository.findByTriggerTypeAndEnabledTrue(TriggerType.SCHEDULED)
                .stream()
                .map(this::resolve)
                .toList();
    }

    public Optional<ResolvedWebhook> webhookById(Long id) {
        return webhookRepository.findByIdAndEnabledTrue(id).map(this::resolve);
    }

    public void recordDelivery(Long id) {
        try {
            webhookRepository.touchLastTriggered(id, LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("[Webhook] Failed to record last triggered time for webhook {}: {}", id, e.getMessage(), e);
        }
    }

    ResolvedWebhook resolve(Webhook webhook) {
        ResolvedWebhook.ResolvedWebhookBuilder builder = ResolvedWebhook.builder()
                .id(webhook.getId())
                .name(webhook.getName())
                .url(webhook.getUrl())
                .method(webhook.getMethod() == null || webhook.getMethod().isBlank()
                        ? DEFAULT_METHOD
                        : webhook.getMethod().trim().toUpperCase(Locale.ROOT));
        try {
            builder.headers(parseHeaders(webhook.getHeaders()))
                    .payload(parseJson(webhook.getPayload()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[Webhook] Invalid headers or payload JSON on webhook {} ({}): {}",
                    webhook.getId(), webhook.getName(), e.getMessage());
            builder.headers(Collections.emptyMap())
                    .payload(JsonNodeFactory.instance.objectNode())
                    .configurationError(e.getMessage());
        }
        return builder.build();
    }

    private JsonNode parseJson(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return objectMapper.readTree(raw);
    }

    private Map<String, String> parseHeaders(String raw) throws JsonProcessingException {
        JsonNode node = parseJson(raw);
        if (node.isNull()) {
            return Collections.emptyMap();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("headers must be a JSON object, got " + node.getNodeType());
        }
        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            headers.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return Collections.unmodifiableMap(headers);
    }
}
