package com.example.analytics.api.response;

/** Counts are -1 when the store could not answer. */
public record GuildSummaryResponse(
    long guildId, long finishedMatches, long crewmateWins, long imposterWins) {}
