/*
 * どこで: Analytics サービス層
 * 何を: 1 試合分の試合情報・テレメトリ・ユーザ結果を MatchStatistics へ畳み込む
 * なぜ: 表示層へ整形前の統計とタイムラインを渡すため
 */
package com.example.analytics.service;

import com.example.analytics.model.ClassifiedEvent;
import com.example.analytics.model.GameEventRecord;
import com.example.analytics.model.MatchRecord;
import com.example.analytics.model.MatchStatistics;
import com.example.analytics.model.PhaseStateEvent;
import com.example.analytics.model.PlayerActionEvent;
import com.example.analytics.model.TimelineEntry;
import com.example.analytics.model.TimelineEventType;
import com.example.analytics.model.UserMatchRecord;
import com.example.common.game.GamePhase;
import com.example.common.game.WinCondition;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MatchStatisticsReducer {

  // 1 件以下のイベント列はタイムラインとして扱わない
  @VisibleForTesting static final int MIN_EVENTS_FOR_TIMELINE = 2;

  private final GameEventClassifier eventClassifier;
  private final OutcomeClassifier outcomeClassifier;

  /**
   * 役割: 試合 1 件分の統計を組み立てる。
   * 動作: 勝者/敗者の振り分けを先に行い、イベントが 2 件以上ある場合だけ入力順に 1 回走査して
   * カウンタとタイムラインを作る。入力は変更しない。
   * 前提: events は呼び出し側で event_time 昇順に並べ替え済みであること。
   */
  public MatchStatistics reduce(
      MatchRecord match, List<GameEventRecord> events, List<UserMatchRecord> outcomes) {
    final long startSeconds = match == null ? 0L : match.startTime();
    final long endSeconds = match == null ? 0L : match.endTime();
    final WinCondition winCondition =
        match == null ? WinCondition.UNKNOWN : outcomeClassifier.classify(match.winType());

    final List<String> winners = new ArrayList<>();
    final List<String> losers = new ArrayList<>();
    if (outcomes != null) {
      for (UserMatchRecord outcome : outcomes) {
        if (outcome.playerWon()) {
          winners.add(outcome.playerName());
        } else {
          losers.add(outcome.playerName());
        }
      }
    }

    final Reduction reduction = new Reduction(startSeconds);
    if (events != null && events.size() >= MIN_EVENTS_FOR_TIMELINE) {
      for (GameEventRecord event : events) {
        final Optional<ClassifiedEvent> classified = eventClassifier.classify(event);
        classified.ifPresent(reduction::accept);
      }
    }

    return new MatchStatistics(
        Instant.ofEpochSecond(startSeconds),
        Instant.ofEpochSecond(endSeconds),
        Duration.ofSeconds(endSeconds - startSeconds),
        winCondition,
        outcomeClassifier.winningFaction(winCondition),
        winners,
        losers,
        reduction.meetings,
        reduction.deaths,
        reduction.exiles,
        reduction.disconnects,
        reduction.timeline);
  }

  /** State of one reduce call; never shared between calls. */
  private static final class Reduction {

    private final long startSeconds;
    private final Set<String> exiledNames = new HashSet<>();
    private final List<TimelineEntry> timeline = new ArrayList<>();
    private int meetings;
    private int deaths;
    private int exiles;
    private int disconnects;

    private Reduction(long startSeconds) {
      this.startSeconds = startSeconds;
    }

    private void accept(ClassifiedEvent event) {
      if (event instanceof PhaseStateEvent phaseState) {
        acceptPhase(phaseState);
      } else if (event instanceof PlayerActionEvent playerAction) {
        acceptPlayerAction(playerAction);
      }
    }

    private void acceptPhase(PhaseStateEvent event) {
      if (event.phase() == GamePhase.DISCUSS) {
        meetings++;
        append(TimelineEventType.DISCUSS, event.timestamp(), "");
      } else if (event.phase() == GamePhase.TASKS) {
        append(TimelineEventType.TASKS, event.timestamp(), "");
      }
    }

    private void acceptPlayerAction(PlayerActionEvent event) {
      if (event.action() == null) {
        return;
      }
      switch (event.action()) {
        case DIED -> {
          deaths++;
          // 追放済みプレイヤーの死亡通知は重複なのでタイムラインには載せない
          if (!exiledNames.contains(event.playerName())) {
            append(TimelineEventType.PLAYER_DEATH, event.timestamp(), event.payload());
          }
        }
        case EXILED -> {
          exiles++;
          exiledNames.add(event.playerName());
          append(TimelineEventType.PLAYER_EXILED, event.timestamp(), event.payload());
        }
        case DISCONNECTED -> {
          disconnects++;
          append(TimelineEventType.PLAYER_DISCONNECT, event.timestamp(), event.payload());
        }
        default -> {
          // JOINED / LEFT などは統計対象外
        }
      }
    }

    private void append(TimelineEventType type, long eventSeconds, String data) {
      timeline.add(new TimelineEntry(type, Duration.ofSeconds(eventSeconds - startSeconds), data));
    }
  }
}
