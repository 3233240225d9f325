package com.example.mediahooks.analytics;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only watch statistics over a half-open window {@code [start, end)}.
 * Query failures are thrown to the caller.
 */
public interface WatchStatisticsProvider {

    /**
     * Titles of the given kind ranked by watched minutes, highest first.
     * Ties keep the store's ordering.
     */
    List<ContentWatchStats> topContent(ContentKind kind, LocalDateTime start, LocalDateTime end, int limit);

    AggregateWatchStats aggregateStats(LocalDateTime start, LocalDateTime end);
}
