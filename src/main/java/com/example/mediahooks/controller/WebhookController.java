package com.example.mediahooks.controller;

import com.example.mediahooks.dto.WebhookRequest;
import com.example.mediahooks.exception.WebhookNotFoundException;
import com.example.mediahooks.model.ResolvedWebhook;
import com.example.mediahooks.model.TriggerType;
import com.example.mediahooks.model.Webhook;
import com.example.mediahooks.repository.WebhookRepository;
import com.example.mediahooks.service.WebhookRegistry;
import com.example.mediahooks.summary.MonthlySummaryService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Webhook 管理与手动触发接口。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookRepository repository;
    private final WebhookRegistry registry;
    private final MonthlySummaryService summaryService;

    /**
     * 全部 webhook（含禁用）。
     *
     * @return webhook 列表
     */
    @GetMapping
    public List<Webhook> list() {
        return repository.findAll();
    }

    /**
     * 启用的 scheduled webhook。
     */
    @GetMapping("/scheduled")
    public List<ResolvedWebhook> scheduled() {
        return registry.scheduledWebhooks();
    }

    /**
     * 创建 webhook。
     *
     * @param request 请求体
     * @return 保存后的 webhook
     */
    @PostMapping
    public ResponseEntity<Webhook> create(@RequestBody WebhookRequest request) {
        if (isBlank(request.name()) || isBlank(request.url())) {
            throw new IllegalArgumentException("name and url are required");
        }
        TriggerType triggerType = request.triggerType() == null ? TriggerType.EVENT : request.triggerType();
        if (triggerType == TriggerType.EVENT && isBlank(request.eventType())) {
            throw new IllegalArgumentException("eventType is required for event webhooks");
        }

        Webhook webhook = Webhook.builder()
                .name(request.name())
                .url(request.url())
                .method(isBlank(request.method()) ? null : request.method())
                .headers(toColumn(request.headers()))
                .payload(toColumn(request.payload()))
                .triggerType(triggerType)
                .eventType(triggerType == TriggerType.EVENT ? request.eventType() : null)
                .enabled(request.enabled() == null || request.enabled())
                .build();
        Webhook saved = repository.save(webhook);
        log.info("[Webhook] Created webhook {} ({}) for {}", saved.getId(), saved.getName(),
                triggerType == TriggerType.EVENT ? saved.getEventType() : "scheduled trigger");
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    /**
     * 删除 webhook。
     *
     * @param id webhook ID
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        if (!repository.existsById(id)) {
            throw new WebhookNotFoundException(id);
        }
        repository.deleteById(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 启用/禁用 webhook。
     *
     * @param id webhook ID
     * @return 更新后的 webhook
     */
    @PostMapping("/{id}/toggle")
    public Webhook toggle(@PathVariable Long id) {
        Webhook webhook = repository.findById(id).orElseThrow(() -> new WebhookNotFoundException(id));
        webhook.setEnabled(!webhook.isEnabled());
        return repository.save(webhook);
    }

    /**
     * 立即发送上月报告。
     *
     * @param id scheduled webhook ID
     * @return 是否发送成功
     */
    @PostMapping("/{id}/monthly-summary")
    public ResponseEntity<Map<String, Boolean>> sendMonthlySummary(@PathVariable Long id) {
        boolean success = summaryService.triggerSummaryWebhook(id);
        return ResponseEntity.status(success ? HttpStatus.OK : HttpStatus.BAD_GATEWAY)
                .body(Map.of("success", success));
    }

    // Strings are stored as given, so a malformed JSON string surfaces at delivery time
    private static String toColumn(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
