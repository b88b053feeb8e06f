/*
 * どこで: Analytics サービス層
 * 何を: game_events の 1 行を phase-state / player-action のいずれかへ分類する
 * なぜ: payload の解釈を境界で 1 回だけ行い、後段は型で分岐できるようにするため
 */
package com.example.analytics.service;

import com.example.analytics.model.ClassifiedEvent;
import com.example.analytics.model.GameEventRecord;
import com.example.analytics.model.PhaseStateEvent;
import com.example.analytics.model.PlayerActionEvent;
import com.example.common.game.CaptureEventType;
import com.example.common.game.GamePhase;
import com.example.common.game.PlayerAction;
import com.example.common.game.PlayerActionPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GameEventClassifier {

  private static final Logger logger = LoggerFactory.getLogger(GameEventClassifier.class);

  private final ObjectReader payloadReader;
  private final AnalyticsMetrics metrics;

  public GameEventClassifier(ObjectMapper objectMapper, AnalyticsMetrics metrics) {
    this.payloadReader = strictPayloadReader(objectMapper);
    this.metrics = metrics;
  }

  /** 整数項目は JSON 整数のみ受け付け、文字列や小数からの変換は失敗させる。共有 mapper は変更しない。 */
  private static ObjectReader strictPayloadReader(ObjectMapper objectMapper) {
    final ObjectMapper strictMapper = objectMapper.copy();
    strictMapper
        .coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
    return strictMapper
        .readerFor(PlayerActionPayload.class)
        .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
  }

  /**
   * 役割: 生イベントを型付きイベントへ変換する。
   * 動作: STATE は phase コードとして、PLAYER は JSON として解釈する。それ以外の種別と
   * 解析できない payload (Action が整数でないものを含む) は空を返し、例外は送出しない。
   */
  public Optional<ClassifiedEvent> classify(GameEventRecord event) {
    if (event.eventType() == CaptureEventType.STATE.code()) {
      final GamePhase phase = GamePhase.fromPayload(event.payload()).orElse(null);
      return Optional.of(new PhaseStateEvent(phase, event.payload(), event.eventTime()));
    }
    if (event.eventType() == CaptureEventType.PLAYER.code()) {
      return parsePlayerAction(event);
    }
    return Optional.empty();
  }

  private Optional<ClassifiedEvent> parsePlayerAction(GameEventRecord event) {
    final PlayerActionPayload payload;
    try {
      payload = event.payload() == null
          ? null
          : payloadReader.<PlayerActionPayload>readValue(event.payload());
    } catch (JsonProcessingException ex) {
      logger.warn(
          "unparsable player event skipped eventId={} matchId={} reason={}",
          event.eventId(),
          event.matchId(),
          ex.getOriginalMessage());
      metrics.recordSkippedEvent("unparsable_payload");
      return Optional.empty();
    }
    if (payload == null || payload.action() == null) {
      logger.warn(
          "player event without action skipped eventId={} matchId={}",
          event.eventId(),
          event.matchId());
      metrics.recordSkippedEvent("missing_action");
      return Optional.empty();
    }
    final PlayerAction action = PlayerAction.fromCode(payload.action()).orElse(null);
    return Optional.of(
        new PlayerActionEvent(action, payload.name(), event.eventTime(), event.payload()));
  }
}
