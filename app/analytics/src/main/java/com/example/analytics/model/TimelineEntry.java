package com.example.analytics.model;

import java.time.Duration;

/** {@code data} is the raw player-action payload, or an empty string for phase entries. */
public record TimelineEntry(TimelineEventType type, Duration offset, String data) {}
