/*
 * どこで: Analytics API
 * 何を: ユーザ単位の件数集計とランキングを返す
 */
package com.example.analytics.api;

import static com.example.analytics.api.AnalyticsRequestParser.orDefault;
import static com.example.analytics.api.AnalyticsRequestParser.parseAction;
import static com.example.analytics.api.AnalyticsRequestParser.parseId;
import static com.example.analytics.api.AnalyticsRequestParser.parseRole;

import com.example.analytics.api.response.PlayerSummaryResponse;
import com.example.analytics.api.response.RankingResponse;
import com.example.analytics.config.AnalyticsLeaderboardProperties;
import com.example.analytics.model.ActionRanking;
import com.example.analytics.model.CoPlayerRanking;
import com.example.analytics.model.FirstTargetRanking;
import com.example.analytics.model.KilledByRanking;
import com.example.analytics.model.ModeCount;
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
@RequestMapping("/v1/analytics")
@RequiredArgsConstructor
public class PlayerStatsController {

  private final RankingService rankingService;
  private final AnalyticsLeaderboardProperties properties;

  @GetMapping("/users/{userId}/summary")
  public PlayerSummaryResponse summary(@PathVariable("userId") String userId) {
    final long user = parseId("userId", userId);
    return new PlayerSummaryResponse(
        user,
        null,
        rankingService.guildsPlayedInByUser(user),
        rankingService.matchesPlayedByUser(user),
        rankingService.wins(user),
        rankingService.matchesAsRole(user, GameRole.CREWMATE),
        rankingService.winsAsRole(user, GameRole.CREWMATE),
        rankingService.matchesAsRole(user, GameRole.IMPOSTER),
        rankingService.winsAsRole(user, GameRole.IMPOSTER));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/summary")
  public PlayerSummaryResponse guildSummary(
      @PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
    final long guild = parseId("guildId", guildId);
    final long user = parseId("userId", userId);
    return new PlayerSummaryResponse(
        user,
        guild,
        null,
        rankingService.matchesPlayedByUserOnGuild(user, guild),
        rankingService.winsOnGuild(user, guild),
        rankingService.matchesAsRoleOnGuild(user, guild, GameRole.CREWMATE),
        rankingService.winsAsRoleOnGuild(user, guild, GameRole.CREWMATE),
        rankingService.matchesAsRoleOnGuild(user, guild, GameRole.IMPOSTER),
        rankingService.winsAsRoleOnGuild(user, guild, GameRole.IMPOSTER));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/colors")
  public RankingResponse<ModeCount<Integer>> colors(
      @PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "colors", guild, rankingService.colorRanking(parseId("userId", userId), guild));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/names")
  public RankingResponse<ModeCount<String>> names(
      @PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "names", guild, rankingService.nameRanking(parseId("userId", userId), guild));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/co-players")
  public RankingResponse<CoPlayerRanking> coPlayers(
      @PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "co_players", guild, rankingService.coPlayerRanking(parseId("userId", userId), guild));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/best-teammates")
  public RankingResponse<TeammateRanking> bestTeammates(
      @PathVariable("guildId") String guildId,
      @PathVariable("userId") String userId,
      @RequestParam(name = "role", defaultValue = "crewmate") String role,
      @RequestParam(name = "min", required = false) Integer min) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "best_teammates",
        guild,
        rankingService.bestTeammates(
            parseId("userId", userId),
            guild,
            parseRole(role),
            orDefault(min, properties.minSharedMatches())));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/worst-teammates")
  public RankingResponse<TeammateRanking> worstTeammates(
      @PathVariable("guildId") String guildId,
      @PathVariable("userId") String userId,
      @RequestParam(name = "role", defaultValue = "crewmate") String role,
      @RequestParam(name = "min", required = false) Integer min) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "worst_teammates",
        guild,
        rankingService.worstTeammates(
            parseId("userId", userId),
            guild,
            parseRole(role),
            orDefault(min, properties.minSharedMatches())));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/actions")
  public RankingResponse<ActionRanking> actions(
      @PathVariable("guildId") String guildId,
      @PathVariable("userId") String userId,
      @RequestParam(name = "action") String action,
      @RequestParam(name = "role", defaultValue = "imposter") String role) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "actions",
        guild,
        rankingService.actionRanking(
            parseId("userId", userId), guild, parseAction(action), parseRole(role)));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/first-target")
  public RankingResponse<FirstTargetRanking> firstTarget(
      @PathVariable("guildId") String guildId,
      @PathVariable("userId") String userId,
      @RequestParam(name = "action", defaultValue = "died") String action,
      @RequestParam(name = "size", required = false) Integer size) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "first_target",
        guild,
        rankingService.firstTarget(
            parseId("userId", userId),
            guild,
            parseAction(action),
            orDefault(size, properties.size())));
  }

  @GetMapping("/guilds/{guildId}/users/{userId}/killed-by")
  public RankingResponse<KilledByRanking> killedBy(
      @PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
    final long guild = parseId("guildId", guildId);
    return new RankingResponse<>(
        "killed_by", guild, rankingService.killedBy(parseId("userId", userId), guild));
  }
}
