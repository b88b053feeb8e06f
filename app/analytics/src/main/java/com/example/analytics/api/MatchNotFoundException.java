package com.example.analytics.api;

public class MatchNotFoundException extends RuntimeException {
  public MatchNotFoundException(long matchId) {
    super("match not found: " + matchId);
  }
}
