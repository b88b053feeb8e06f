/*
 * Where: common game vocabulary
 * What: Phase codes carried by phase-state telemetry payloads
 */
package com.example.common.game;

import java.util.Optional;

public enum GamePhase {
  LOBBY(0),
  TASKS(1),
  DISCUSS(2),
  MENU(3),
  GAME_OVER(4);

  private final int code;

  GamePhase(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Payload form of the code as capture stores it, e.g. {@code "2"}. */
  public String payload() {
    return Integer.toString(code);
  }

  public static Optional<GamePhase> fromPayload(String payload) {
    if (payload == null) {
      return Optional.empty();
    }
    final String trimmed = payload.trim();
    for (GamePhase phase : values()) {
      if (phase.payload().equals(trimmed)) {
        return Optional.of(phase);
      }
    }
    return Optional.empty();
  }
}
