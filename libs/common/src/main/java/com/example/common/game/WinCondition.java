/*
 * Where: common game vocabulary
 * What: Typed match outcome decoded from the stored win_type code
 * Why: Capture and analytics agree on one code table
 */
package com.example.common.game;

import java.util.ArrayList;
import java.util.List;

public enum WinCondition {
  HUMANS_BY_TASK(0, WinningFaction.CREWMATE),
  HUMANS_BY_VOTE(1, WinningFaction.CREWMATE),
  IMPOSTOR_BY_VOTE(2, WinningFaction.IMPOSTER),
  IMPOSTOR_BY_KILL(3, WinningFaction.IMPOSTER),
  IMPOSTOR_BY_SABOTAGE(4, WinningFaction.IMPOSTER),
  IMPOSTOR_DISCONNECT(5, WinningFaction.IMPOSTER),
  HUMANS_DISCONNECT(6, WinningFaction.CREWMATE),
  UNKNOWN(-1, WinningFaction.DEFAULTED_CREWMATE);

  private final int code;
  private final WinningFaction winningFaction;

  WinCondition(int code, WinningFaction winningFaction) {
    this.code = code;
    this.winningFaction = winningFaction;
  }

  public int code() {
    return code;
  }

  public WinningFaction winningFaction() {
    return winningFaction;
  }

  /**
   * 役割: games.win_type の値を列挙型へ変換する。
   * 動作: 既知コード以外はすべて UNKNOWN を返し、例外は送出しない。
   */
  public static WinCondition fromCode(int code) {
    for (WinCondition condition : values()) {
      if (condition != UNKNOWN && condition.code == code) {
        return condition;
      }
    }
    return UNKNOWN;
  }

  /** Codes whose outcome is a genuine win for {@code role}. UNKNOWN is never included. */
  public static List<Integer> codesWonBy(GameRole role) {
    final List<Integer> codes = new ArrayList<>();
    for (WinCondition condition : values()) {
      if (condition != UNKNOWN && condition.winningFaction.role() == role) {
        codes.add(condition.code);
      }
    }
    return codes;
  }
}
