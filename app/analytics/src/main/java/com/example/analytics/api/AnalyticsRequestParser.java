/*
 * Where: Analytics API
 * What: Converts path/query strings into typed identifiers, roles and actions
 * Why: Identifiers travel as canonical decimal strings and must become 64-bit values
 */
package com.example.analytics.api;

import com.example.common.game.GameRole;
import com.example.common.game.PlayerAction;

final class AnalyticsRequestParser {

  private AnalyticsRequestParser() {}

  static long parseId(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidAnalyticsRequestException(name + " is required");
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidAnalyticsRequestException(name + " must be a numeric id");
    }
  }

  static GameRole parseRole(String role) {
    try {
      return GameRole.fromValue(role);
    } catch (IllegalArgumentException ex) {
      throw new InvalidAnalyticsRequestException(ex.getMessage());
    }
  }

  static PlayerAction parseAction(String action) {
    try {
      return PlayerAction.fromValue(action);
    } catch (IllegalArgumentException ex) {
      throw new InvalidAnalyticsRequestException(ex.getMessage());
    }
  }

  static int orDefault(Integer requested, int fallback) {
    return requested == null ? fallback : requested;
  }
}
