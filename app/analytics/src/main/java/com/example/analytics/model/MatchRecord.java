/*
 * Where: Analytics domain model
 * What: Snapshot of one games row
 * Why: Shared by the reducer and the match statistics lookup
 */
package com.example.analytics.model;

/** Times are epoch seconds; {@code endTime} stays -1 until the match has finished. */
public record MatchRecord(
    long matchId, long guildId, String connectCode, long startTime, long endTime, int winType) {

  public static final long UNFINISHED = -1L;

  public boolean finished() {
    return endTime != UNFINISHED;
  }
}
