package com.example.mediahooks.summary;

import com.example.mediahooks.analytics.AggregateWatchStats;
import com.example.mediahooks.analytics.ContentWatchStats;

import java.time.LocalDate;
import java.util.List;

/**
 * Monthly watch digest. Built on demand, never stored.
 */
public record SummaryDigest(
        Period period,
        List<ContentWatchStats> topMovies,
        List<ContentWatchStats> topSeries,
        AggregateWatchStats stats) {

    /**
     * @param start first day of the month
     * @param end   last day of the month
     * @param label display name, e.g. "septembre 2026"
     */
    public record Period(LocalDate start, LocalDate end, String label) {
    }
}
