package com.example.analytics.api.response;

/**
 * Per-user counts; {@code guildId} is null for the cross-guild summary, {@code guilds} is null
 * for the single-guild one. Counts are -1 when the store could not answer.
 */
public record PlayerSummaryResponse(
    long userId,
    Long guildId,
    Long guilds,
    long matches,
    long wins,
    long crewmateMatches,
    long crewmateWins,
    long imposterMatches,
    long imposterWins) {}
