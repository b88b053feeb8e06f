/*
 * どこで: Analytics データアクセス
 * 何を: game_events テーブルの登録/取得を担う
 */
package com.example.analytics.repository;

import com.example.analytics.model.GameEventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class GameEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(GameEventRecord record) {
    final String sql =
        """
        INSERT INTO game_events (event_id, user_id, game_id, event_time, event_type, payload)
        VALUES (:eventId, :userId, :matchId, :eventTime, :eventType, :payload::jsonb)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("userId", record.userId())
            .addValue("matchId", record.matchId())
            .addValue("eventTime", record.eventTime())
            .addValue("eventType", record.eventType())
            .addValue("payload", record.payload());
    jdbcTemplate.update(sql, params);
    return record.eventId();
  }

  /** Reducer expects ascending event time; event_id breaks ties in capture order. */
  public List<GameEventRecord> findByMatchId(long matchId) {
    final String sql =
        """
        SELECT event_id, user_id, game_id, event_time, event_type, payload #>> '{}' AS payload_text
        FROM game_events
        WHERE game_id = :matchId
        ORDER BY event_time, event_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private GameEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long userId = rs.getLong("user_id");
    return new GameEventRecord(
        rs.getLong("event_id"),
        rs.wasNull() ? null : userId,
        rs.getLong("game_id"),
        rs.getLong("event_time"),
        rs.getInt("event_type"),
        rs.getString("payload_text"));
  }
}
