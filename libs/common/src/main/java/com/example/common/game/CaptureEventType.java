/*
 * Where: common game vocabulary
 * What: Kind codes stored in game_events.event_type
 */
package com.example.common.game;

public enum CaptureEventType {
  CONNECTION(0),
  LOBBY(1),
  STATE(2),
  PLAYER(3),
  GAME_OVER(4);

  private final int code;

  CaptureEventType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
