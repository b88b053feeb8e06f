/*
 * どこで: Analytics サービス層
 * 何を: 件数集計とランキング集計の公開窓口
 * なぜ: 集計はベストエフォートであり、DB 障害を呼び出し元へ伝播させないため
 */
package com.example.analytics.service;

import com.example.analytics.model.ActionRanking;
import com.example.analytics.model.CoPlayerRanking;
import com.example.analytics.model.FirstTargetRanking;
import com.example.analytics.model.KilledByRanking;
import com.example.analytics.model.ModeCount;
import com.example.analytics.model.PlayerRanking;
import com.example.analytics.model.TeammateRanking;
import com.example.analytics.repository.LeaderboardRepository;
import com.example.analytics.repository.LeaderboardRepository.TeammateOutcome;
import com.example.analytics.repository.MatchRepository;
import com.example.analytics.repository.UserMatchRepository;
import com.example.common.game.GameRole;
import com.example.common.game.PlayerAction;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Every method is total: a failed query is logged once and reported as {@link #UNKNOWN_COUNT}
 * for counts or an empty list for rankings. Thresholds and sizes are used exactly as given.
 */
@Service
@RequiredArgsConstructor
public class RankingService {

  public static final long UNKNOWN_COUNT = -1L;

  private static final Logger logger = LoggerFactory.getLogger(RankingService.class);

  private final MatchRepository matchRepository;
  private final UserMatchRepository userMatchRepository;
  private final LeaderboardRepository leaderboardRepository;
  private final AnalyticsMetrics metrics;

  public long finishedMatchesOnGuild(long guildId) {
    return count("finished_matches_on_guild", () -> matchRepository.countFinishedOnGuild(guildId));
  }

  public long matchesWonByRoleOnGuild(long guildId, GameRole role) {
    return count(
        "matches_won_by_role_on_guild", () -> matchRepository.countWonByRoleOnGuild(guildId, role));
  }

  public long matchesPlayedByUser(long userId) {
    return count("matches_played_by_user", () -> userMatchRepository.countMatches(userId));
  }

  public long guildsPlayedInByUser(long userId) {
    return count("guilds_played_in_by_user", () -> userMatchRepository.countGuilds(userId));
  }

  public long matchesPlayedByUserOnGuild(long userId, long guildId) {
    return count(
        "matches_played_by_user_on_guild",
        () -> userMatchRepository.countMatchesOnGuild(userId, guildId));
  }

  public long wins(long userId) {
    return count("wins", () -> userMatchRepository.countWins(userId));
  }

  public long winsOnGuild(long userId, long guildId) {
    return count("wins_on_guild", () -> userMatchRepository.countWinsOnGuild(userId, guildId));
  }

  public long matchesAsRole(long userId, GameRole role) {
    return count("matches_as_role", () -> userMatchRepository.countMatchesAsRole(userId, role));
  }

  public long winsAsRole(long userId, GameRole role) {
    return count("wins_as_role", () -> userMatchRepository.countWinsAsRole(userId, role));
  }

  public long matchesAsRoleOnGuild(long userId, long guildId, GameRole role) {
    return count(
        "matches_as_role_on_guild",
        () -> userMatchRepository.countMatchesAsRoleOnGuild(userId, guildId, role));
  }

  public long winsAsRoleOnGuild(long userId, long guildId, GameRole role) {
    return count(
        "wins_as_role_on_guild",
        () -> userMatchRepository.countWinsAsRoleOnGuild(userId, guildId, role));
  }

  public List<ModeCount<Integer>> colorRanking(long userId, long guildId) {
    return rows(
        "color_ranking", () -> leaderboardRepository.colorRankingForPlayerOnGuild(userId, guildId));
  }

  public List<ModeCount<String>> nameRanking(long userId, long guildId) {
    return rows(
        "name_ranking", () -> leaderboardRepository.nameRankingForPlayerOnGuild(userId, guildId));
  }

  public List<ModeCount<Long>> totalMatchesRanking(long guildId) {
    return rows(
        "total_matches_ranking", () -> leaderboardRepository.totalMatchesRankingForGuild(guildId));
  }

  public List<CoPlayerRanking> coPlayerRanking(long userId, long guildId) {
    return rows(
        "co_player_ranking",
        () -> leaderboardRepository.coPlayerRankingForPlayerOnGuild(userId, guildId));
  }

  public List<PlayerRanking> winRateRanking(long guildId) {
    return rows("win_rate_ranking", () -> leaderboardRepository.winRateRankingForGuild(guildId));
  }

  public List<PlayerRanking> winRateRanking(long guildId, GameRole role) {
    return rows(
        "win_rate_ranking_by_role",
        () -> leaderboardRepository.winRateRankingForGuildByRole(guildId, role));
  }

  public List<TeammateRanking> bestTeammates(
      long userId, long guildId, GameRole role, int leaderboardMin) {
    return rows(
        "best_teammates",
        () ->
            leaderboardRepository.teammatesForPlayer(
                userId, guildId, role, TeammateOutcome.WIN, leaderboardMin));
  }

  public List<TeammateRanking> worstTeammates(
      long userId, long guildId, GameRole role, int leaderboardMin) {
    return rows(
        "worst_teammates",
        () ->
            leaderboardRepository.teammatesForPlayer(
                userId, guildId, role, TeammateOutcome.LOSS, leaderboardMin));
  }

  public List<TeammateRanking> bestTeammatesOnGuild(long guildId, GameRole role, int leaderboardMin) {
    return rows(
        "best_teammates_on_guild",
        () ->
            leaderboardRepository.teammatesForGuild(
                guildId, role, TeammateOutcome.WIN, leaderboardMin));
  }

  public List<TeammateRanking> worstTeammatesOnGuild(
      long guildId, GameRole role, int leaderboardMin) {
    return rows(
        "worst_teammates_on_guild",
        () ->
            leaderboardRepository.teammatesForGuild(
                guildId, role, TeammateOutcome.LOSS, leaderboardMin));
  }

  public List<ActionRanking> actionRanking(
      long userId, long guildId, PlayerAction action, GameRole role) {
    return rows(
        "action_ranking",
        () -> leaderboardRepository.actionRankingForPlayer(userId, guildId, action, role));
  }

  public List<FirstTargetRanking> firstTarget(
      long userId, long guildId, PlayerAction action, int leaderboardSize) {
    return rows(
        "first_target",
        () -> leaderboardRepository.firstTargetForPlayer(userId, guildId, action, leaderboardSize));
  }

  public List<FirstTargetRanking> firstTargetRanking(
      long guildId, PlayerAction action, int minTotalMatches, int leaderboardSize) {
    return rows(
        "first_target_ranking",
        () ->
            leaderboardRepository.firstTargetRankingForGuild(
                guildId, action, minTotalMatches, leaderboardSize));
  }

  public List<KilledByRanking> killedBy(long userId, long guildId) {
    return rows("killed_by", () -> leaderboardRepository.killedByForPlayer(userId, guildId));
  }

  public List<KilledByRanking> killedByRanking(long guildId, int minTotalMatches) {
    return rows(
        "killed_by_ranking",
        () -> leaderboardRepository.killedByRankingForGuild(guildId, minTotalMatches));
  }

  private long count(String operation, LongSupplier query) {
    try {
      return query.getAsLong();
    } catch (DataAccessException ex) {
      recordFailure(operation, ex);
      return UNKNOWN_COUNT;
    }
  }

  private <T> List<T> rows(String operation, Supplier<List<T>> query) {
    try {
      return query.get();
    } catch (DataAccessException ex) {
      recordFailure(operation, ex);
      return List.of();
    }
  }

  private void recordFailure(String operation, DataAccessException ex) {
    logger.error("analytics query failed operation={}", operation, ex);
    metrics.recordQueryFailure(operation);
  }
}
