/*
 * Where: Analytics domain model
 * What: Per-match statistics folded from a match, its telemetry and its outcome rows
 * Why: Handed to presentation as-is, without any formatting applied
 */
package com.example.analytics.model;

import com.example.common.game.WinCondition;
import com.example.common.game.WinningFaction;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record MatchStatistics(
    Instant startTime,
    Instant endTime,
    Duration duration,
    WinCondition winCondition,
    WinningFaction winningFaction,
    List<String> winnerNames,
    List<String> loserNames,
    int meetings,
    int deaths,
    int exiles,
    int disconnects,
    List<TimelineEntry> timeline) {

  public MatchStatistics {
    // 入力の表示名に null が混ざっても落とさないよう List.copyOf は使わない
    winnerNames = Collections.unmodifiableList(new ArrayList<>(winnerNames));
    loserNames = Collections.unmodifiableList(new ArrayList<>(loserNames));
    timeline = List.copyOf(timeline);
  }

  public int playerCount() {
    return winnerNames.size() + loserNames.size();
  }

  /** Deaths that were not votes; exiled players are usually reported dead as well. */
  public int killCount() {
    return Math.max(0, deaths - exiles);
  }
}
