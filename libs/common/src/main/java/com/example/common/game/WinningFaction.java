/*
 * Where: common game vocabulary
 * What: Faction credited with a match outcome
 * Why: Lets callers tell a real crewmate win from the fallback applied to unknown outcomes
 */
package com.example.common.game;

public enum WinningFaction {
  CREWMATE(GameRole.CREWMATE, false),
  IMPOSTER(GameRole.IMPOSTER, false),
  // 未知の結果は従来通り Crewmate 扱いにするが、判別できるよう別の値にする
  DEFAULTED_CREWMATE(GameRole.CREWMATE, true);

  private final GameRole role;
  private final boolean defaulted;

  WinningFaction(GameRole role, boolean defaulted) {
    this.role = role;
    this.defaulted = defaulted;
  }

  public GameRole role() {
    return role;
  }

  public boolean isDefaulted() {
    return defaulted;
  }
}
