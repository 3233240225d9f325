package com.example.mediahooks.event;

/**
 * Event names published by the playback and library monitors.
 */
public final class MediaEventNames {

    public static final String PLAYBACK_STARTED = "playback_started";
    public static final String PLAYBACK_ENDED = "playback_ended";
    public static final String MEDIA_RECENTLY_ADDED = "media_recently_added";

    private MediaEventNames() {
    }
}
