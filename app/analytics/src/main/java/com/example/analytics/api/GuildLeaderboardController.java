/*
 * どこで: Analytics API
 * 何を: ギルド単位の件数集計とリーダーボードを返す
 * なぜ: しきい値の省略時だけ設定値で補い、集計ロジックへは常に明示値を渡すため
 */
package com.example.analytics.api;

import static com.example.analytics.api.AnalyticsRequestParser.orDefault;
import static com.example.analytics.api.AnalyticsRequestParser.parseAction;
import static com.example.analytics.api.AnalyticsRequestParser.parseId;
import static com.example.analytics.api.AnalyticsRequestParser.parseRole;

import com.example.analytics.api.response.GuildSummaryResponse;
import com.example.analytics.api.response.RankingResponse;
import com.example.analytics.config.AnalyticsLeaderboardProperties;
import com.example.analytics.model.FirstTargetRanking;
import com.example.analytics.model.KilledByRanking;
import com.example.analytics.model.ModeCount;
import com.example.analytics.model.PlayerRanking;
import com.example.analytics.model.TeammateRanking;
import com.example.analytics.service.RankingService;
import com.example.common.game.GameRole;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analytics/guilds/{guildId}")
@RequiredArgsConstructor
public class GuildLeaderboardController {

  private final RankingService rankingService;
  private final AnalyticsLeaderboardProperties properties;

  @GetMapping("/summary")
  public GuildSummaryResponse summary(@PathVariable("guildId") String guildId) {
    final long id = parseId("guildId", guildId);
    return new GuildSummaryResponse(
        id,
        rankingService.finishedMatchesOnGuild(id),
        rankingService.matchesWonByRoleOnGuild(id, GameRole.CREWMATE),
        rankingService.matchesWonByRoleOnGuild(id, GameRole.IMPOSTER));
  }

  @GetMapping("/leaderboards/win-rate")
  public RankingResponse<PlayerRanking> winRate(
      @PathVariable("guildId") String guildId,
      @RequestParam(name = "role", required = false) String role) {
    final long id = parseId("guildId", guildId);
    if (role == null) {
      return new RankingResponse<>("win_rate", id, rankingService.winRateRanking(id));
    }
    return new RankingResponse<>(
        "win_rate", id, rankingService.winRateRanking(id, parseRole(role)));
  }

  @GetMapping("/leaderboards/total-matches")
  public RankingResponse<ModeCount<Long>> totalMatches(@PathVariable("guildId") String guildId) {
    final long id = parseId("guildId", guildId);
    return new RankingResponse<>("total_matches", id, rankingService.totalMatchesRanking(id));
  }

  @GetMapping("/leaderboards/best-teammates")
  public RankingResponse<TeammateRanking> bestTeammates(
      @PathVariable("guildId") String guildId,
      @RequestParam(name = "role", defaultValue = "crewmate") String role,
      @RequestParam(name = "min", required = false) Integer min) {
    final long id = parseId("guildId", guildId);
    return new RankingResponse<>(
        "best_teammates",
        id,
        rankingService.bestTeammatesOnGuild(
            id, parseRole(role), orDefault(min, properties.minSharedMatches())));
  }

  @GetMapping("/leaderboards/worst-teammates")
  public RankingResponse<TeammateRanking> worstTeammates(
      @PathVariable("guildId") String guildId,
      @RequestParam(name = "role", defaultValue = "crewmate") String role,
      @RequestParam(name = "min", required = false) Integer min) {
    final long id = parseId("guildId", guildId);
    return new RankingResponse<>(
        "worst_teammates",
        id,
        rankingService.worstTeammatesOnGuild(
            id, parseRole(role), orDefault(min, properties.minSharedMatches())));
  }

  @GetMapping("/leaderboards/first-targets")
  public RankingResponse<FirstTargetRanking> firstTargets(
      @PathVariable("guildId") String guildId,
      @RequestParam(name = "action", defaultValue = "died") String action,
      @RequestParam(name = "min_total_matches", required = false) Integer minTotalMatches,
      @RequestParam(name = "size", required = false) Integer size) {
    final long id = parseId("guildId", guildId);
    return new RankingResponse<>(
        "first_targets",
        id,
        rankingService.firstTargetRanking(
            id,
            parseAction(action),
            orDefault(minTotalMatches, properties.minTotalMatches()),
            orDefault(size, properties.size())));
  }

  @GetMapping("/leaderboards/killed-by")
  public RankingResponse<KilledByRanking> killedBy(
      @PathVariable("guildId") String guildId,
      @RequestParam(name = "min_total_matches", required = false) Integer minTotalMatches) {
    final long id = parseId("guildId", guildId);
    return new RankingResponse<>(
        "killed_by",
        id,
        rankingService.killedByRanking(
            id, orDefault(minTotalMatches, properties.minTotalMatches())));
  }
}
