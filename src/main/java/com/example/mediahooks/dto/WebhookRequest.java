package com.example.mediahooks.dto;

import com.example.mediahooks.model.TriggerType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Webhook 创建请求。headers/payload 可以是 JSON 对象，也可以是 JSON 字符串。
 */
public record WebhookRequest(
        String name,
        String url,
        String method,
        JsonNode headers,
        JsonNode payload,
        TriggerType triggerType,
        String eventType,
        Boolean enabled) {
}
