/*
 * どこで: Analytics API
 * 何を: ギルド/ユーザ単位の試合データ削除を受け付ける
 */
package com.example.analytics.api;

import static com.example.analytics.api.AnalyticsRequestParser.parseId;

import com.example.analytics.api.response.DeletedRowsResponse;
import com.example.analytics.service.MatchDataService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analytics")
@RequiredArgsConstructor
public class MatchDataController {

  private final MatchDataService matchDataService;

  @DeleteMapping("/guilds/{guildId}/matches")
  public DeletedRowsResponse deleteGuildMatches(@PathVariable("guildId") String guildId) {
    return new DeletedRowsResponse(
        matchDataService.deleteGuildData(parseId("guildId", guildId)));
  }

  @DeleteMapping("/users/{userId}/matches")
  public DeletedRowsResponse deleteUserMatches(@PathVariable("userId") String userId) {
    return new DeletedRowsResponse(matchDataService.deleteUserData(parseId("userId", userId)));
  }
}
