package com.example.mediahooks.repository;

import com.example.mediahooks.model.PlaybackActivity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 播放记录仓储接口（只读统计查询）。
 */
@Repository
public interface PlaybackActivityRepository extends JpaRepository<PlaybackActivity, String> {

    /**
     * 统计窗口内观看时长最多的电影（无剧集名的记录）。
     *
     * @param start    窗口起点（含）
     * @param end      窗口终点（不含）
     * @param pageable 返回条数
     * @return 排行
     */
    @Query("SELECT a.nowPlayingItemName AS title, COUNT(DISTINCT a.userId) AS uniqueViewers, "
            + "SUM(a.playbackDuration) AS totalDuration "
            + "FROM PlaybackActivity a "
            + "WHERE a.activityDateInserted >= :start AND a.activityDateInserted < :end "
            + "AND a.nowPlayingItemName IS NOT NULL AND a.seriesName IS NULL "
            + "GROUP BY a.nowPlayingItemName, a.nowPlayingItemId "
            + "ORDER BY SUM(a.playbackDuration) DESC")
    List<ContentWatchRow> findTopMovies(@Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end, Pageable pageable);

    /**
     * 统计窗口内观看时长最多的剧集（按剧集名聚合）。
     */
    @Query("SELECT a.seriesName AS title, COUNT(DISTINCT a.userId) AS uniqueViewers, "
            + "SUM(a.playbackDuration) AS totalDuration "
            + "FROM PlaybackActivity a "
            + "WHERE a.activityDateInserted >= :start AND a.activityDateInserted < :end "
            + "AND a.seriesName IS NOT NULL "
            + "GROUP BY a.seriesName "
            + "ORDER BY SUM(a.playbackDuration) DESC")
    List<ContentWatchRow> findTopSeries(@Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end, Pageable pageable);

    @Query("SELECT COUNT(DISTINCT a.userId) AS activeUsers, COUNT(a) AS totalPlays, "
            + "SUM(a.playbackDuration) AS totalDuration "
            + "FROM PlaybackActivity a "
            + "WHERE a.activityDateInserted >= :start AND a.activityDateInserted < :end")
    AggregateWatchRow aggregate(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    interface ContentWatchRow {
        String getTitle();

        Number getUniqueViewers();

        Number getTotalDuration(); // milliseconds
    }

    interface AggregateWatchRow {
        Number getActiveUsers();

        Number getTotalPlays();

        Number getTotalDuration(); // milliseconds, null when the window is empty
    }
}
