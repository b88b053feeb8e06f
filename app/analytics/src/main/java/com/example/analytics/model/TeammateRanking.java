/*
 * Where: Analytics ranking rows
 * What: Joint outcome of two users who played the same role in the same matches
 * Why: Serves both best-teammate (wins) and worst-teammate (losses) rankings
 */
package com.example.analytics.model;

/**
 * {@code outcomes} counts shared wins for best-teammate rankings and shared losses for
 * worst-teammate rankings; {@code rate} is {@code outcomes / total * 100}.
 */
public record TeammateRanking(
    long userId, long teammateId, long total, long outcomes, double rate) {}
