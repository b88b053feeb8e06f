/*
 * Where: Analytics service layer
 * What: Loads one match with its telemetry and outcomes and reduces it to statistics
 */
package com.example.analytics.service;

import com.example.analytics.model.GameEventRecord;
import com.example.analytics.model.MatchRecord;
import com.example.analytics.model.MatchStatistics;
import com.example.analytics.model.UserMatchRecord;
import com.example.analytics.repository.GameEventRepository;
import com.example.analytics.repository.MatchRepository;
import com.example.analytics.repository.UserMatchRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchStatisticsService {

  private static final Logger logger = LoggerFactory.getLogger(MatchStatisticsService.class);

  private final MatchRepository matchRepository;
  private final GameEventRepository gameEventRepository;
  private final UserMatchRepository userMatchRepository;
  private final MatchStatisticsReducer reducer;
  private final AnalyticsMetrics metrics;

  /** Empty when the match does not exist or could not be loaded. */
  public Optional<MatchStatistics> statisticsFor(long matchId) {
    final MatchRecord match;
    final List<GameEventRecord> events;
    final List<UserMatchRecord> outcomes;
    try {
      final Optional<MatchRecord> found = matchRepository.findById(matchId);
      if (found.isEmpty()) {
        return Optional.empty();
      }
      match = found.get();
      // イベントは event_time 昇順で取得する (reducer は並べ替えない)
      events = gameEventRepository.findByMatchId(matchId);
      outcomes = userMatchRepository.findByMatchId(matchId);
    } catch (DataAccessException ex) {
      logger.error("match statistics load failed matchId={}", matchId, ex);
      metrics.recordQueryFailure("match_statistics");
      return Optional.empty();
    }
    final MatchStatistics statistics =
        metrics.timeReduce(() -> reducer.reduce(match, events, outcomes));
    logger.debug(
        "match statistics reduced matchId={} events={} timeline={}",
        matchId,
        events.size(),
        statistics.timeline().size());
    return Optional.of(statistics);
  }
}
