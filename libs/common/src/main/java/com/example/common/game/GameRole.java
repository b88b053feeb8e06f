/*
 * Where: common game vocabulary
 * What: Role a player was assigned in a match (users_games.player_role)
 */
package com.example.common.game;

public enum GameRole {
  CREWMATE(0, "crewmate"),
  IMPOSTER(1, "imposter");

  private final int code;
  private final String value;

  GameRole(int code, String value) {
    this.code = code;
    this.value = value;
  }

  public int code() {
    return code;
  }

  public String value() {
    return value;
  }

  public static GameRole fromCode(int code) {
    for (GameRole role : values()) {
      if (role.code == code) {
        return role;
      }
    }
    throw new IllegalArgumentException("unsupported role code: " + code);
  }

  /**
   * 役割: API で受け取った role 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: role は null でないことを呼び出し側で保証する。
   */
  public static GameRole fromValue(String role) {
    for (GameRole gameRole : values()) {
      if (gameRole.value.equalsIgnoreCase(role)) {
        return gameRole;
      }
    }
    throw new IllegalArgumentException("unsupported role: " + role);
  }
}
