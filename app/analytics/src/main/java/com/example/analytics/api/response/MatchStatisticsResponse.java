/*
 * どこで: Analytics API モデル
 * 何を: 試合統計をそのまま JSON へ写す
 * なぜ: 表示層が整形前の値を受け取れるようにするため
 */
package com.example.analytics.api.response;

import com.example.analytics.model.MatchStatistics;
import java.time.Instant;
import java.util.List;

public record MatchStatisticsResponse(
    long matchId,
    Instant startTime,
    Instant endTime,
    long durationSeconds,
    String winCondition,
    String winningRole,
    boolean winningRoleDefaulted,
    List<String> winnerNames,
    List<String> loserNames,
    int playerCount,
    int meetings,
    int deaths,
    int kills,
    int exiles,
    int disconnects,
    List<TimelineEntryResponse> timeline) {

  public static MatchStatisticsResponse from(long matchId, MatchStatistics statistics) {
    return new MatchStatisticsResponse(
        matchId,
        statistics.startTime(),
        statistics.endTime(),
        statistics.duration().toSeconds(),
        statistics.winCondition().name(),
        statistics.winningFaction().role().value(),
        statistics.winningFaction().isDefaulted(),
        statistics.winnerNames(),
        statistics.loserNames(),
        statistics.playerCount(),
        statistics.meetings(),
        statistics.deaths(),
        statistics.killCount(),
        statistics.exiles(),
        statistics.disconnects(),
        statistics.timeline().stream().map(TimelineEntryResponse::from).toList());
  }
}
