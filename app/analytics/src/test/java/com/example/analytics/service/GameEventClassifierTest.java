/*
 * どこで: Analytics サービス層の単体テスト
 * 何を: game_events 行の分類と不正 payload のスキップを検証する
 */
package com.example.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.analytics.model.ClassifiedEvent;
import com.example.analytics.model.GameEventRecord;
import com.example.analytics.model.PhaseStateEvent;
import com.example.analytics.model.PlayerActionEvent;
import com.example.common.game.GamePhase;
import com.example.common.game.PlayerAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GameEventClassifierTest {

  private SimpleMeterRegistry registry;
  private GameEventClassifier classifier;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    classifier = new GameEventClassifier(new ObjectMapper(), new AnalyticsMetrics(registry));
  }

  @Test
  void stateEventBecomesPhaseState() {
    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(1L, null, 5L, 120L, 2, "2"));

    assertThat(result).containsInstanceOf(PhaseStateEvent.class);
    final PhaseStateEvent event = (PhaseStateEvent) result.orElseThrow();
    assertThat(event.phase()).isEqualTo(GamePhase.DISCUSS);
    assertThat(event.timestamp()).isEqualTo(120L);
  }

  @Test
  void unknownPhaseCodeKeepsEventWithoutPhase() {
    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(1L, null, 5L, 120L, 2, "77"));

    assertThat(result).isPresent();
    assertThat(((PhaseStateEvent) result.orElseThrow()).phase()).isNull();
  }

  @Test
  void playerEventParsesActionAndName() {
    final String payload = "{\"Action\":6,\"Name\":\"Red\",\"Color\":0,\"IsDead\":true}";

    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(2L, 9L, 5L, 150L, 3, payload));

    final PlayerActionEvent event = (PlayerActionEvent) result.orElseThrow();
    assertThat(event.action()).isEqualTo(PlayerAction.EXILED);
    assertThat(event.playerName()).isEqualTo("Red");
    assertThat(event.payload()).isEqualTo(payload);
  }

  @Test
  void playerEventWithoutActionIsSkipped() {
    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(3L, 9L, 5L, 150L, 3, "{\"Name\":\"Red\"}"));

    assertThat(result).isEmpty();
    assertThat(
            registry
                .get("analytics.event.skipped.total")
                .tag("reason", "missing_action")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void malformedPlayerPayloadIsSkipped() {
    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(4L, 9L, 5L, 150L, 3, "{\"Action\":"));

    assertThat(result).isEmpty();
    assertThat(
            registry
                .get("analytics.event.skipped.total")
                .tag("reason", "unparsable_payload")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{\"Action\":2.7,\"Name\":\"X\"}",
        "{\"Action\":2.0,\"Name\":\"X\"}",
        "{\"Action\":\"2\",\"Name\":\"Y\"}"
      })
  void nonIntegerActionIsNotCoercedIntoAnAction(String payload) {
    final Optional<ClassifiedEvent> result =
        classifier.classify(new GameEventRecord(7L, 9L, 5L, 150L, 3, payload));

    assertThat(result).isEmpty();
    assertThat(
            registry
                .get("analytics.event.skipped.total")
                .tag("reason", "unparsable_payload")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void sharedMapperKeepsItsOwnCoercionSettings() throws Exception {
    final ObjectMapper shared = new ObjectMapper();
    new GameEventClassifier(shared, new AnalyticsMetrics(registry));

    assertThat(shared.readValue("\"2\"", Integer.class)).isEqualTo(2);
  }

  @Test
  void otherEventTypesAreIgnored() {
    assertThat(classifier.classify(new GameEventRecord(5L, 9L, 5L, 150L, 0, "{}"))).isEmpty();
    assertThat(classifier.classify(new GameEventRecord(6L, null, 5L, 150L, 4, "x"))).isEmpty();
  }
}
