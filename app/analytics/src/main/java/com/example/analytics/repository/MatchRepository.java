/*
 * どこで: Analytics データアクセス
 * 何を: games テーブルの登録/取得/集計/削除を担う
 * なぜ: 試合単位の統計とギルド単位の件数集計を支えるため
 */
package com.example.analytics.repository;

import com.example.analytics.model.MatchRecord;
import com.example.common.game.GameRole;
import com.example.common.game.WinCondition;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MatchRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(MatchRecord record) {
    final String sql =
        """
        INSERT INTO games (game_id, guild_id, connect_code, start_time, win_type, end_time)
        VALUES (:matchId, :guildId, :connectCode, :startTime, :winType, :endTime)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("matchId", record.matchId())
            .addValue("guildId", record.guildId())
            .addValue("connectCode", record.connectCode())
            .addValue("startTime", record.startTime())
            .addValue("winType", record.winType())
            .addValue("endTime", record.endTime());
    jdbcTemplate.update(sql, params);
    return record.matchId();
  }

  public Optional<MatchRecord> findById(long matchId) {
    final String sql =
        """
        SELECT game_id, guild_id, connect_code, start_time, win_type, end_time
        FROM games
        WHERE game_id = :matchId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    final List<MatchRecord> records = jdbcTemplate.query(sql, params, this::mapRow);
    return records.stream().findFirst();
  }

  /** Finished matches only; running matches still carry end_time = -1. */
  public long countFinishedOnGuild(long guildId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM games
        WHERE guild_id = :guildId
          AND end_time <> -1
        """;
    return count(sql, new MapSqlParameterSource().addValue("guildId", guildId));
  }

  public long countWonByRoleOnGuild(long guildId, GameRole role) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM games
        WHERE guild_id = :guildId
          AND win_type IN (:winTypes)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("guildId", guildId)
            .addValue("winTypes", WinCondition.codesWonBy(role));
    return count(sql, params);
  }

  /** users_games と game_events は外部キーの ON DELETE CASCADE で一緒に消える。 */
  public int deleteAllForGuild(long guildId) {
    final String sql = "DELETE FROM games WHERE guild_id = :guildId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("guildId", guildId));
  }

  private long count(String sql, MapSqlParameterSource params) {
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MatchRecord(
        rs.getLong("game_id"),
        rs.getLong("guild_id"),
        rs.getString("connect_code"),
        rs.getLong("start_time"),
        rs.getLong("end_time"),
        rs.getInt("win_type"));
  }
}
