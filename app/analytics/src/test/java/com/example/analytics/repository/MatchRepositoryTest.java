/*
 * どこで: MatchRepository の統合テスト
 * 何を: 試合の取得、ギルド件数集計、カスケード削除を検証する
 */
package com.example.analytics.repository;

import static com.example.analytics.repository.LeaderboardFixture.GUILD_ID;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.analytics.AbstractPostgresContainerTest;
import com.example.analytics.model.MatchRecord;
import com.example.analytics.model.UserMatchRecord;
import com.example.common.game.GameRole;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MatchRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private MatchRepository matchRepository;
  @Autowired private UserMatchRepository userMatchRepository;
  @Autowired private GameEventRepository gameEventRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    LeaderboardFixture.clear(jdbcTemplate);
    new LeaderboardFixture(matchRepository, userMatchRepository, gameEventRepository).load();
  }

  @Test
  void findByIdReturnsStoredMatch() {
    final Optional<MatchRecord> match = matchRepository.findById(5L);

    assertThat(match).contains(new MatchRecord(5L, GUILD_ID, "CODE5", 5_000L, 5_600L, 2));
    assertThat(matchRepository.findById(404L)).isEmpty();
    assertThat(matchRepository.findById(10L).orElseThrow().finished()).isFalse();
  }

  @Test
  void countsSkipRunningMatches() {
    assertThat(matchRepository.countFinishedOnGuild(GUILD_ID)).isEqualTo(9L);
    assertThat(matchRepository.countWonByRoleOnGuild(GUILD_ID, GameRole.CREWMATE)).isEqualTo(4L);
    assertThat(matchRepository.countWonByRoleOnGuild(GUILD_ID, GameRole.IMPOSTER)).isEqualTo(5L);
    assertThat(matchRepository.countFinishedOnGuild(LeaderboardFixture.OTHER_GUILD_ID)).isZero();
  }

  @Test
  void deleteAllForGuildCascadesToOutcomesAndEvents() {
    matchRepository.insert(
        new MatchRecord(50L, LeaderboardFixture.OTHER_GUILD_ID, "OTHER", 100L, 200L, 0));
    userMatchRepository.insert(
        new UserMatchRecord(1L, LeaderboardFixture.OTHER_GUILD_ID, 50L, "Alice", 3, 0, true));

    final int deleted = matchRepository.deleteAllForGuild(GUILD_ID);

    assertThat(deleted).isEqualTo(10);
    assertThat(count("SELECT COUNT(*) FROM users_games")).isEqualTo(1L);
    assertThat(count("SELECT COUNT(*) FROM game_events")).isZero();
    assertThat(matchRepository.findById(50L)).isPresent();
  }

  private long count(String sql) {
    return jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
  }
}
