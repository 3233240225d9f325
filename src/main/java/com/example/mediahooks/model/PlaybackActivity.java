package com.example.mediahooks.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One playback session recorded by the activity monitor. Read-only here.
 */
@Entity
@Table(name = "playback_activity")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaybackActivity {

    @Id
    private String id;

    private String userId;

    private String nowPlayingItemId;

    private String nowPlayingItemName;

    private String seriesName; // null for movies

    private Long playbackDuration; // milliseconds

    private LocalDateTime activityDateInserted;
}
