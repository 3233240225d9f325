package com.example.mediahooks.analytics;

import com.example.mediahooks.repository.PlaybackActivityRepository;
import com.example.mediahooks.repository.PlaybackActivityRepository.AggregateWatchRow;
import com.example.mediahooks.repository.PlaybackActivityRepository.ContentWatchRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaWatchStatisticsProvider implements WatchStatisticsProvider {

    private static final double MILLIS_PER_MINUTE = 60_000d;
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final PlaybackActivityRepository activityRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ContentWatchStats> topContent(ContentKind kind, LocalDateTime start, LocalDateTime end, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<ContentWatchRow> rows = kind == ContentKind.MOVIE
                ? activityRepository.findTopMovies(start, end, page)
                : activityRepository.findTopSeries(start, end, page);

        log.debug("[Analytics] top {} {} between {} and {}: {} rows", limit, kind, start, end, rows.size());

        return rows.stream()
                .map(row -> new ContentWatchStats(
                        row.getTitle(),
                        toLong(row.getUniqueViewers()),
                        toLong(row.getTotalDuration()) / MILLIS_PER_MINUTE))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public AggregateWatchStats aggregateStats(LocalDateTime start, LocalDateTime end) {
        AggregateWatchRow row = activityRepository.aggregate(start, end);
        if (row == null) {
            return AggregateWatchStats.empty();
        }
        return new AggregateWatchStats(
                toLong(row.getActiveUsers()),
                toLong(row.getTotalPlays()),
                toLong(row.getTotalDuration()) / MILLIS_PER_HOUR);
    }

    private static long toLong(Number value) {
        return value == null ? 0L : value.longValue();
    }
}
