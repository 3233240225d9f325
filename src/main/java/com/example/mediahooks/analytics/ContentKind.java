package com.example.mediahooks.analytics;

public enum ContentKind {
    MOVIE,
    SERIES
}
