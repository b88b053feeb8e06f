/*
 * どこで: Analytics API
 * 何を: 試合 1 件分の統計とタイムラインを返す
 */
package com.example.analytics.api;

import static com.example.analytics.api.AnalyticsRequestParser.parseId;

import com.example.analytics.api.response.MatchStatisticsResponse;
import com.example.analytics.service.MatchStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analytics/matches")
@RequiredArgsConstructor
public class MatchStatisticsController {

  private final MatchStatisticsService matchStatisticsService;

  @GetMapping("/{matchId}/statistics")
  public MatchStatisticsResponse statistics(@PathVariable("matchId") String matchId) {
    final long id = parseId("matchId", matchId);
    return matchStatisticsService
        .statisticsFor(id)
        .map(statistics -> MatchStatisticsResponse.from(id, statistics))
        .orElseThrow(() -> new MatchNotFoundException(id));
  }
}
