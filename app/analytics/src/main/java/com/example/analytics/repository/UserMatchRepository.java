/*
 * どこで: Analytics データアクセス
 * 何を: users_games テーブルの登録/取得とユーザ単位の件数集計を担う
 * なぜ: 試合結果の勝敗振り分けとプロフィール統計を支えるため
 */
package com.example.analytics.repository;

import com.example.analytics.model.UserMatchRecord;
import com.example.common.game.GameRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserMatchRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UserMatchRecord record) {
    final String sql =
        """
        INSERT INTO users_games (
          user_id, guild_id, game_id, player_name, player_color, player_role, player_won
        ) VALUES (
          :userId, :guildId, :matchId, :playerName, :playerColor, :playerRole, :playerWon
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("guildId", record.guildId())
            .addValue("matchId", record.matchId())
            .addValue("playerName", record.playerName())
            .addValue("playerColor", record.playerColor())
            .addValue("playerRole", record.playerRole())
            .addValue("playerWon", record.playerWon());
    jdbcTemplate.update(sql, params);
  }

  /** Insertion order is kept so winner/loser lists follow the order outcomes were written. */
  public List<UserMatchRecord> findByMatchId(long matchId) {
    final String sql =
        """
        SELECT user_id, guild_id, game_id, player_name, player_color, player_role, player_won
        FROM users_games
        WHERE game_id = :matchId
        ORDER BY row_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countMatches(long userId) {
    return count("SELECT COUNT(*) FROM users_games WHERE user_id = :userId", userParams(userId));
  }

  public long countGuilds(long userId) {
    return count(
        "SELECT COUNT(DISTINCT guild_id) FROM users_games WHERE user_id = :userId",
        userParams(userId));
  }

  public long countMatchesOnGuild(long userId, long guildId) {
    return count(
        "SELECT COUNT(*) FROM users_games WHERE user_id = :userId AND guild_id = :guildId",
        userParams(userId).addValue("guildId", guildId));
  }

  public long countWins(long userId) {
    return count(
        "SELECT COUNT(*) FROM users_games WHERE user_id = :userId AND player_won",
        userParams(userId));
  }

  public long countWinsOnGuild(long userId, long guildId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users_games
        WHERE user_id = :userId
          AND guild_id = :guildId
          AND player_won
        """;
    return count(sql, userParams(userId).addValue("guildId", guildId));
  }

  public long countMatchesAsRole(long userId, GameRole role) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users_games
        WHERE user_id = :userId
          AND player_role = :role
        """;
    return count(sql, userParams(userId).addValue("role", role.code()));
  }

  public long countWinsAsRole(long userId, GameRole role) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users_games
        WHERE user_id = :userId
          AND player_role = :role
          AND player_won
        """;
    return count(sql, userParams(userId).addValue("role", role.code()));
  }

  public long countMatchesAsRoleOnGuild(long userId, long guildId, GameRole role) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users_games
        WHERE user_id = :userId
          AND guild_id = :guildId
          AND player_role = :role
        """;
    return count(
        sql, userParams(userId).addValue("guildId", guildId).addValue("role", role.code()));
  }

  public long countWinsAsRoleOnGuild(long userId, long guildId, GameRole role) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users_games
        WHERE user_id = :userId
          AND guild_id = :guildId
          AND player_role = :role
          AND player_won
        """;
    return count(
        sql, userParams(userId).addValue("guildId", guildId).addValue("role", role.code()));
  }

  public int deleteAllForUser(long userId) {
    return jdbcTemplate.update(
        "DELETE FROM users_games WHERE user_id = :userId", userParams(userId));
  }

  private MapSqlParameterSource userParams(long userId) {
    return new MapSqlParameterSource().addValue("userId", userId);
  }

  private long count(String sql, MapSqlParameterSource params) {
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private UserMatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserMatchRecord(
        rs.getLong("user_id"),
        rs.getLong("guild_id"),
        rs.getLong("game_id"),
        rs.getString("player_name"),
        rs.getInt("player_color"),
        rs.getInt("player_role"),
        rs.getBoolean("player_won"));
  }
}
