/*
 * Where: common game vocabulary
 * What: Action codes carried in the "Action" field of player telemetry
 */
package com.example.common.game;

import java.util.Optional;

public enum PlayerAction {
  JOINED(0),
  LEFT(1),
  DIED(2),
  CHANGED_COLOR(3),
  FORCE_UPDATED(4),
  DISCONNECTED(5),
  EXILED(6);

  private final int code;

  PlayerAction(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Value stored under {@code payload ->> 'Action'}. */
  public String payloadValue() {
    return Integer.toString(code);
  }

  public static Optional<PlayerAction> fromCode(int code) {
    for (PlayerAction action : values()) {
      if (action.code == code) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }

  public static PlayerAction fromValue(String value) {
    for (PlayerAction action : values()) {
      if (action.name().equalsIgnoreCase(value.replace('-', '_'))) {
        return action;
      }
    }
    throw new IllegalArgumentException("unsupported action: " + value);
  }
}
