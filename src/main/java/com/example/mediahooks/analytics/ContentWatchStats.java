package com.example.mediahooks.analytics;

/**
 * One ranked title in a watch window.
 *
 * @param title         movie name or series name
 * @param uniqueViewers distinct users who played it
 * @param totalMinutes  summed playback time in minutes
 */
public record ContentWatchStats(String title, long uniqueViewers, double totalMinutes) {
}
