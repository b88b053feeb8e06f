package com.example.analytics.model;

/**
 * How often a user was the first player hit by an action in a match. {@code total} is the
 * user's eligible (crewmate) match count and {@code rate} the percentage of it.
 */
public record FirstTargetRanking(long userId, long firstTargetCount, long total, double rate) {}
