package com.example.analytics.model;

/** Win-rate leaderboard row; {@code winRate} is a percentage. */
public record PlayerRanking(long userId, long wins, long total, double winRate) {}
