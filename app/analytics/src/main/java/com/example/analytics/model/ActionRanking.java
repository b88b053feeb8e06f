package com.example.analytics.model;

public record ActionRanking(long userId, long actionCount, long total, double winRate) {}
