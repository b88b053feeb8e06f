/*
 * どこで: Analytics データアクセス
 * 何を: users_games / game_events を横断するランキング集計クエリを担う
 * なぜ: 件数フィルタとタイブレークを DB 側で確定させ、結果順を決定的にするため
 */
package com.example.analytics.repository;

import com.example.analytics.model.ActionRanking;
import com.example.analytics.model.CoPlayerRanking;
import com.example.analytics.model.FirstTargetRanking;
import com.example.analytics.model.KilledByRanking;
import com.example.analytics.model.ModeCount;
import com.example.analytics.model.PlayerRanking;
import com.example.analytics.model.TeammateRanking;
import com.example.common.game.CaptureEventType;
import com.example.common.game.GameRole;
import com.example.common.game.PlayerAction;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LeaderboardRepository {

  /** Which shared outcome a teammate ranking counts. */
  public enum TeammateOutcome {
    WIN("a.player_won"),
    LOSS("NOT a.player_won");

    private final String predicate;

    TeammateOutcome(String predicate) {
      this.predicate = predicate;
    }
  }

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<ModeCount<Integer>> colorRankingForPlayerOnGuild(long userId, long guildId) {
    final String sql =
        """
        SELECT COUNT(*) AS occurrences, player_color AS mode
        FROM users_games
        WHERE user_id = :userId
          AND guild_id = :guildId
        GROUP BY player_color
        ORDER BY occurrences DESC, mode
        """;
    return jdbcTemplate.query(
        sql,
        userOnGuild(userId, guildId),
        (rs, rowNum) -> new ModeCount<>(rs.getLong("occurrences"), rs.getInt("mode")));
  }

  public List<ModeCount<String>> nameRankingForPlayerOnGuild(long userId, long guildId) {
    final String sql =
        """
        SELECT COUNT(*) AS occurrences, player_name AS mode
        FROM users_games
        WHERE user_id = :userId
          AND guild_id = :guildId
        GROUP BY player_name
        ORDER BY occurrences DESC, mode
        """;
    return jdbcTemplate.query(
        sql,
        userOnGuild(userId, guildId),
        (rs, rowNum) -> new ModeCount<>(rs.getLong("occurrences"), rs.getString("mode")));
  }

  public List<ModeCount<Long>> totalMatchesRankingForGuild(long guildId) {
    final String sql =
        """
        SELECT COUNT(*) AS occurrences, user_id AS mode
        FROM users_games
        WHERE guild_id = :guildId
        GROUP BY user_id
        ORDER BY occurrences DESC, mode
        """;
    return jdbcTemplate.query(
        sql,
        guild(guildId),
        (rs, rowNum) -> new ModeCount<>(rs.getLong("occurrences"), rs.getLong("mode")));
  }

  public List<CoPlayerRanking> coPlayerRankingForPlayerOnGuild(long userId, long guildId) {
    final String sql =
        """
        SELECT b.user_id,
               COUNT(*) AS shared_matches,
               COUNT(*)::decimal / totals.total * 100 AS share_percent
        FROM users_games a
        JOIN users_games b ON b.game_id = a.game_id AND b.user_id <> a.user_id
        CROSS JOIN (
          SELECT COUNT(*) AS total
          FROM users_games
          WHERE user_id = :userId
            AND guild_id = :guildId
        ) totals
        WHERE a.user_id = :userId
          AND a.guild_id = :guildId
        GROUP BY b.user_id, totals.total
        ORDER BY share_percent DESC, user_id
        """;
    return jdbcTemplate.query(
        sql,
        userOnGuild(userId, guildId),
        (rs, rowNum) ->
            new CoPlayerRanking(
                rs.getLong("user_id"), rs.getLong("shared_matches"), rs.getDouble("share_percent")));
  }

  /** Ordered by win rate only; equal rates keep whatever order the store returns. */
  public List<PlayerRanking> winRateRankingForGuild(long guildId) {
    final String sql =
        """
        SELECT user_id,
               COUNT(*) FILTER (WHERE player_won) AS wins,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE player_won)::decimal / COUNT(*) * 100 AS win_rate
        FROM users_games
        WHERE guild_id = :guildId
        GROUP BY user_id
        ORDER BY win_rate DESC
        """;
    return jdbcTemplate.query(sql, guild(guildId), this::mapPlayerRanking);
  }

  public List<PlayerRanking> winRateRankingForGuildByRole(long guildId, GameRole role) {
    final String sql =
        """
        SELECT user_id,
               COUNT(*) FILTER (WHERE player_won) AS wins,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE player_won)::decimal / COUNT(*) * 100 AS win_rate
        FROM users_games
        WHERE guild_id = :guildId
          AND player_role = :role
        GROUP BY user_id
        ORDER BY win_rate DESC
        """;
    return jdbcTemplate.query(
        sql, guild(guildId).addValue("role", role.code()), this::mapPlayerRanking);
  }

  /**
   * 役割: 指定ユーザと同じロールで同じ試合に出た相手ごとの共同勝率(敗率)を返す。
   * 動作: 共有試合数が leaderboardMin 未満のペアは除外し、率 → 件数 → 共有試合数の降順で並べる。
   */
  public List<TeammateRanking> teammatesForPlayer(
      long userId, long guildId, GameRole role, TeammateOutcome outcome, int leaderboardMin) {
    final String sql =
        """
        SELECT a.user_id,
               b.user_id AS teammate_id,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE %1$s) AS outcomes,
               COUNT(*) FILTER (WHERE %1$s)::decimal / COUNT(*) * 100 AS rate
        FROM users_games a
        JOIN users_games b ON b.game_id = a.game_id AND b.user_id <> a.user_id
        WHERE a.guild_id = :guildId
          AND a.user_id = :userId
          AND a.player_role = :role
          AND b.player_role = :role
        GROUP BY a.user_id, b.user_id
        HAVING COUNT(*) >= :leaderboardMin
        ORDER BY rate DESC, outcomes DESC, total DESC, teammate_id
        """
            .formatted(outcome.predicate);
    final MapSqlParameterSource params =
        userOnGuild(userId, guildId)
            .addValue("role", role.code())
            .addValue("leaderboardMin", leaderboardMin);
    return jdbcTemplate.query(sql, params, this::mapTeammateRanking);
  }

  /**
   * 役割: ギルド全体で同じロールを組んだユーザペアの共同勝率(敗率)を返す。
   * 動作: ペアは ID の大きい方を user_id、小さい方を teammate_id に正規化し 1 回だけ数える。
   * 共有試合数が leaderboardMin 未満のペアは除外する。
   */
  public List<TeammateRanking> teammatesForGuild(
      long guildId, GameRole role, TeammateOutcome outcome, int leaderboardMin) {
    final String sql =
        """
        SELECT a.user_id,
               b.user_id AS teammate_id,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE %1$s) AS outcomes,
               COUNT(*) FILTER (WHERE %1$s)::decimal / COUNT(*) * 100 AS rate
        FROM users_games a
        JOIN users_games b ON b.game_id = a.game_id AND b.user_id < a.user_id
        WHERE a.guild_id = :guildId
          AND a.player_role = :role
          AND b.player_role = :role
        GROUP BY a.user_id, b.user_id
        HAVING COUNT(*) >= :leaderboardMin
        ORDER BY rate DESC, outcomes DESC, total DESC, user_id, teammate_id
        """
            .formatted(outcome.predicate);
    final MapSqlParameterSource params =
        guild(guildId).addValue("role", role.code()).addValue("leaderboardMin", leaderboardMin);
    return jdbcTemplate.query(sql, params, this::mapTeammateRanking);
  }

  /** How often the user performed {@code action} while playing {@code role}, with that role's win rate. */
  public List<ActionRanking> actionRankingForPlayer(
      long userId, long guildId, PlayerAction action, GameRole role) {
    final String sql =
        """
        SELECT ug.user_id,
               COUNT(ge.event_id) AS action_count,
               totals.total,
               totals.win_rate
        FROM users_games ug
        JOIN (
          SELECT user_id,
                 COUNT(*) AS total,
                 COUNT(*) FILTER (WHERE player_won)::decimal / COUNT(*) * 100 AS win_rate
          FROM users_games
          WHERE user_id = :userId
            AND guild_id = :guildId
            AND player_role = :role
          GROUP BY user_id
        ) totals ON totals.user_id = ug.user_id
        LEFT JOIN game_events ge
          ON ge.game_id = ug.game_id
         AND ge.user_id = ug.user_id
         AND ge.event_type = :playerEventType
         AND ge.payload ->> 'Action' = :action
        WHERE ug.user_id = :userId
          AND ug.guild_id = :guildId
          AND ug.player_role = :role
        GROUP BY ug.user_id, totals.total, totals.win_rate
        ORDER BY win_rate DESC, total DESC
        """;
    final MapSqlParameterSource params =
        userOnGuild(userId, guildId)
            .addValue("role", role.code())
            .addValue("playerEventType", CaptureEventType.PLAYER.code())
            .addValue("action", action.payloadValue());
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new ActionRanking(
                rs.getLong("user_id"),
                rs.getLong("action_count"),
                rs.getLong("total"),
                rs.getDouble("win_rate")));
  }

  public List<FirstTargetRanking> firstTargetForPlayer(
      long userId, long guildId, PlayerAction action, int leaderboardSize) {
    final String sql =
        firstTargetQuery(
            """
            AND ug.user_id = :userId
            """);
    final MapSqlParameterSource params =
        firstTargetParams(guildId, action, leaderboardSize).addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapFirstTargetRanking);
  }

  /** Rows whose eligible match count is below {@code minTotalMatches} are left out. */
  public List<FirstTargetRanking> firstTargetRankingForGuild(
      long guildId, PlayerAction action, int minTotalMatches, int leaderboardSize) {
    final String sql =
        firstTargetQuery(
            """
            AND totals.total >= :minTotalMatches
            """);
    final MapSqlParameterSource params =
        firstTargetParams(guildId, action, leaderboardSize)
            .addValue("minTotalMatches", minTotalMatches);
    return jdbcTemplate.query(sql, params, this::mapFirstTargetRanking);
  }

  public List<KilledByRanking> killedByForPlayer(long userId, long guildId) {
    final String sql =
        killedByQuery(
            """
            AND victim.user_id = :userId
            """,
            "",
            "imposter_id");
    return jdbcTemplate.query(
        sql, killedByParams(guildId).addValue("userId", userId), this::mapKilledByRanking);
  }

  public List<KilledByRanking> killedByRankingForGuild(long guildId, int minTotalMatches) {
    final String sql =
        killedByQuery(
            "",
            """
            HAVING COUNT(*) >= :minTotalMatches
            """,
            "user_id, imposter_id");
    return jdbcTemplate.query(
        sql,
        killedByParams(guildId).addValue("minTotalMatches", minTotalMatches),
        this::mapKilledByRanking);
  }

  // 各試合で最初に action を受けたプレイヤーを求め、ユーザのクルー試合数で正規化する。
  // 分子も分母と同じくクルー試合に限る
  private String firstTargetQuery(String extraCondition) {
    return """
        SELECT ug.user_id,
               COUNT(*) AS first_target_count,
               totals.total,
               COALESCE(COUNT(*)::decimal / NULLIF(totals.total, 0) * 100, 0) AS rate
        FROM users_games ug
        JOIN LATERAL (
          SELECT ge.user_id
          FROM game_events ge
          WHERE ge.game_id = ug.game_id
            AND ge.event_type = :playerEventType
            AND ge.payload ->> 'Action' = :action
          ORDER BY ge.event_time, ge.event_id
          LIMIT 1
        ) first_event ON first_event.user_id = ug.user_id
        JOIN LATERAL (
          SELECT COUNT(*) AS total
          FROM users_games t
          WHERE t.user_id = ug.user_id
            AND t.guild_id = :guildId
            AND t.player_role = :eligibleRole
        ) totals ON TRUE
        WHERE ug.guild_id = :guildId
          AND ug.player_role = :eligibleRole
        %s
        GROUP BY ug.user_id, totals.total
        ORDER BY rate DESC, first_target_count DESC, totals.total DESC, user_id
        LIMIT :leaderboardSize
        """
        .formatted(extraCondition);
  }

  private MapSqlParameterSource firstTargetParams(
      long guildId, PlayerAction action, int leaderboardSize) {
    return guild(guildId)
        .addValue("playerEventType", CaptureEventType.PLAYER.code())
        .addValue("action", action.payloadValue())
        .addValue("eligibleRole", GameRole.CREWMATE.code())
        .addValue("leaderboardSize", leaderboardSize);
  }

  // クルーとして死亡した試合を、同じ試合にいたインポスターごとに数える
  private String killedByQuery(String extraCondition, String having, String finalOrder) {
    return """
        SELECT victim.user_id,
               imposter.user_id AS imposter_id,
               COUNT(death.event_id) AS deaths,
               COUNT(*) AS encounters,
               COUNT(death.event_id)::decimal / COUNT(*) * 100 AS death_rate
        FROM users_games victim
        JOIN users_games imposter
          ON imposter.game_id = victim.game_id
         AND imposter.player_role = :imposterRole
        LEFT JOIN LATERAL (
          SELECT ge.event_id
          FROM game_events ge
          WHERE ge.game_id = victim.game_id
            AND ge.user_id = victim.user_id
            AND ge.event_type = :playerEventType
            AND ge.payload ->> 'Action' = :diedAction
          LIMIT 1
        ) death ON TRUE
        WHERE victim.guild_id = :guildId
          AND victim.player_role = :crewmateRole
        %s
        GROUP BY victim.user_id, imposter.user_id
        %s
        ORDER BY death_rate DESC, deaths DESC, encounters DESC, %s
        """
        .formatted(extraCondition, having, finalOrder);
  }

  private MapSqlParameterSource killedByParams(long guildId) {
    return guild(guildId)
        .addValue("imposterRole", GameRole.IMPOSTER.code())
        .addValue("crewmateRole", GameRole.CREWMATE.code())
        .addValue("playerEventType", CaptureEventType.PLAYER.code())
        .addValue("diedAction", PlayerAction.DIED.payloadValue());
  }

  private MapSqlParameterSource guild(long guildId) {
    return new MapSqlParameterSource().addValue("guildId", guildId);
  }

  private MapSqlParameterSource userOnGuild(long userId, long guildId) {
    return guild(guildId).addValue("userId", userId);
  }

  private PlayerRanking mapPlayerRanking(ResultSet rs, int rowNum) throws SQLException {
    return new PlayerRanking(
        rs.getLong("user_id"), rs.getLong("wins"), rs.getLong("total"), rs.getDouble("win_rate"));
  }

  private TeammateRanking mapTeammateRanking(ResultSet rs, int rowNum) throws SQLException {
    return new TeammateRanking(
        rs.getLong("user_id"),
        rs.getLong("teammate_id"),
        rs.getLong("total"),
        rs.getLong("outcomes"),
        rs.getDouble("rate"));
  }

  private FirstTargetRanking mapFirstTargetRanking(ResultSet rs, int rowNum) throws SQLException {
    return new FirstTargetRanking(
        rs.getLong("user_id"),
        rs.getLong("first_target_count"),
        rs.getLong("total"),
        rs.getDouble("rate"));
  }

  private KilledByRanking mapKilledByRanking(ResultSet rs, int rowNum) throws SQLException {
    return new KilledByRanking(
        rs.getLong("user_id"),
        rs.getLong("imposter_id"),
        rs.getLong("deaths"),
        rs.getLong("encounters"),
        rs.getDouble("death_rate"));
  }
}
