/*
 * Where: Analytics service layer
 * What: Removes stored match data for a guild or a user
 * Why: Lets a guild reset its history and a user withdraw their records
 */
package com.example.analytics.service;

import com.example.analytics.repository.MatchRepository;
import com.example.analytics.repository.UserMatchRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MatchDataService {

  private static final Logger logger = LoggerFactory.getLogger(MatchDataService.class);

  private final MatchRepository matchRepository;
  private final UserMatchRepository userMatchRepository;

  // 削除は集計と違い失敗を呼び出し元へ伝える
  @Transactional
  public int deleteGuildData(long guildId) {
    final int deleted = matchRepository.deleteAllForGuild(guildId);
    logger.info("guild match data deleted guildId={} matches={}", guildId, deleted);
    return deleted;
  }

  @Transactional
  public int deleteUserData(long userId) {
    final int deleted = userMatchRepository.deleteAllForUser(userId);
    logger.info("user match data deleted userId={} rows={}", userId, deleted);
    return deleted;
  }
}
