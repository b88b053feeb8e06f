/*
 * どこで: Analytics サービス層の単体テスト
 * 何を: 集計失敗時に -1 / 空リストへ落とし、メトリクスへ記録することを検証する
 * なぜ: ランキング表示が DB 障害で例外にならないことを保証するため
 */
package com.example.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.analytics.model.KilledByRanking;
import com.example.analytics.model.TeammateRanking;
import com.example.analytics.repository.LeaderboardRepository;
import com.example.analytics.repository.LeaderboardRepository.TeammateOutcome;
import com.example.analytics.repository.MatchRepository;
import com.example.analytics.repository.UserMatchRepository;
import com.example.common.game.GameRole;
import com.example.common.game.PlayerAction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class RankingServiceTest {

  @Mock private MatchRepository matchRepository;
  @Mock private UserMatchRepository userMatchRepository;
  @Mock private LeaderboardRepository leaderboardRepository;

  private SimpleMeterRegistry registry;
  private RankingService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new RankingService(
            matchRepository,
            userMatchRepository,
            leaderboardRepository,
            new AnalyticsMetrics(registry));
  }

  @Test
  void countReturnsRepositoryValue() {
    when(userMatchRepository.countWinsAsRoleOnGuild(1L, 10L, GameRole.IMPOSTER)).thenReturn(7L);

    assertThat(service.winsAsRoleOnGuild(1L, 10L, GameRole.IMPOSTER)).isEqualTo(7L);
  }

  @Test
  void countReturnsUnknownWhenStoreFails() {
    when(matchRepository.countFinishedOnGuild(10L))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThat(service.finishedMatchesOnGuild(10L)).isEqualTo(RankingService.UNKNOWN_COUNT);
    assertThat(
            registry
                .get("analytics.query.failure.total")
                .tag("operation", "finished_matches_on_guild")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void rankingReturnsEmptyWhenStoreFails() {
    when(leaderboardRepository.killedByRankingForGuild(anyLong(), anyInt()))
        .thenThrow(new DataAccessResourceFailureException("timeout"));

    final List<KilledByRanking> rows = service.killedByRanking(10L, 4);

    assertThat(rows).isEmpty();
    assertThat(
            registry
                .get("analytics.query.failure.total")
                .tag("operation", "killed_by_ranking")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void teammateRankingsPassOutcomeAndThresholdThrough() {
    final TeammateRanking row = new TeammateRanking(1L, 2L, 6L, 5L, 83.33d);
    when(leaderboardRepository.teammatesForPlayer(
            1L, 10L, GameRole.CREWMATE, TeammateOutcome.WIN, 5))
        .thenReturn(List.of(row));

    assertThat(service.bestTeammates(1L, 10L, GameRole.CREWMATE, 5)).containsExactly(row);

    service.worstTeammatesOnGuild(10L, GameRole.IMPOSTER, 3);
    verify(leaderboardRepository)
        .teammatesForGuild(10L, GameRole.IMPOSTER, TeammateOutcome.LOSS, 3);
  }

  @Test
  void firstTargetRankingUsesGivenSizeAndThreshold() {
    service.firstTargetRanking(10L, PlayerAction.DIED, 4, 10);

    verify(leaderboardRepository)
        .firstTargetRankingForGuild(eq(10L), eq(PlayerAction.DIED), eq(4), eq(10));
  }
}
