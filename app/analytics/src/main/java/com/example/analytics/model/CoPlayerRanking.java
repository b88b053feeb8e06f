package com.example.analytics.model;

/** Share of a user's matches in which {@code userId} also played, as a percentage. */
public record CoPlayerRanking(long userId, long sharedMatches, double percent) {}
