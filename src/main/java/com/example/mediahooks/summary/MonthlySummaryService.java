package com.example.mediahooks.summary;

import com.example.mediahooks.analytics.AggregateWatchStats;
import com.example.mediahooks.analytics.ContentKind;
import com.example.mediahooks.analytics.ContentWatchStats;
import com.example.mediahooks.analytics.WatchStatisticsProvider;
import com.example.mediahooks.model.ResolvedWebhook;
import com.example.mediahooks.service.WebhookDispatcher;
import com.example.mediahooks.service.WebhookRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 月度观看报告：统计上一个自然月的数据并推送到指定的 scheduled webhook。
 */
@Service
@Slf4j
public class MonthlySummaryService {

    private final WebhookRegistry registry;
    private final WebhookDispatcher dispatcher;
    private final WatchStatisticsProvider statistics;
    private final DiscordEmbedRenderer renderer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int topLimit;
    private final DateTimeFormatter labelFormatter;

    public MonthlySummaryService(WebhookRegistry registry,
            WebhookDispatcher dispatcher,
            WatchStatisticsProvider statistics,
            DiscordEmbedRenderer renderer,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.webhook.summary.top-limit:5}") int topLimit,
            @Value("${app.webhook.summary.locale:fr-FR}") String locale) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.statistics = statistics;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.topLimit = topLimit;
        this.labelFormatter = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.forLanguageTag(locale));
    }

    /**
     * Builds the digest of the previous calendar month. Analytics failures
     * propagate.
     */
    public SummaryDigest buildDigest() {
        YearMonth month = YearMonth.now(clock).minusMonths(1);
        LocalDate start = month.atDay(1);
        LocalDate end = month.atEndOfMonth();
        LocalDateTime windowStart = start.atStartOfDay();
        LocalDateTime windowEnd = month.plusMonths(1).atDay(1).atStartOfDay();

        List<ContentWatchStats> topMovies = statistics.topContent(ContentKind.MOVIE, windowStart, windowEnd, topLimit);
        List<ContentWatchStats> topSeries = statistics.topContent(ContentKind.SERIES, windowStart, windowEnd, topLimit);
        AggregateWatchStats stats = statistics.aggregateStats(windowStart, windowEnd);

        return new SummaryDigest(
                new SummaryDigest.Period(start, end, labelFormatter.format(month)),
                topMovies,
                topSeries,
                stats == null ? AggregateWatchStats.empty() : stats);
    }

    /**
     * Sends the monthly report to one enabled webhook.
     *
     * @return {@code false} if the webhook is unknown or disabled, the digest
     *         could not be built, or the HTTP call did not complete
     */
    public boolean triggerSummaryWebhook(Long webhookId) {
        Optional<ResolvedWebhook> found;
        try {
            found = registry.webhookById(webhookId);
        } catch (Exception e) {
            log.error("[Summary] Error while loading webhook {}: {}", webhookId, e.getMessage(), e);
            return false;
        }
        if (found.isEmpty()) {
            log.error("[Summary] Webhook ID {} not found or disabled", webhookId);
            return false;
        }
        ResolvedWebhook webhook = found.get();

        JsonNode payload;
        try {
            SummaryDigest digest = buildDigest();
            payload = objectMapper.valueToTree(renderer.render(digest));
        } catch (Exception e) {
            log.error("[Summary] Error while preparing the monthly report: {}", e.getMessage(), e);
            return false;
        }

        boolean delivered = dispatcher.deliverChatPayload(webhook, payload);
        if (delivered) {
            log.info("[Summary] Monthly report webhook {} sent successfully", webhook.getName());
        }
        return delivered;
    }
}
