/*
 * Where: Analytics domain model
 * What: Snapshot of one game_events row as captured
 */
package com.example.analytics.model;

/**
 * Raw telemetry record. {@code userId} is null for phase-state events and {@code payload} is
 * either a phase code such as {@code "2"} or a JSON player-action document.
 */
public record GameEventRecord(
    long eventId, Long userId, long matchId, long eventTime, int eventType, String payload) {}
