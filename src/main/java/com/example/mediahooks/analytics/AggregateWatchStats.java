package com.example.mediahooks.analytics;

public record AggregateWatchStats(long activeUsers, long totalPlays, double totalHours) {

    public static AggregateWatchStats empty() {
        return new AggregateWatchStats(0, 0, 0);
    }
}
