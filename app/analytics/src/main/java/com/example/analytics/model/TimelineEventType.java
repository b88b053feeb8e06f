package com.example.analytics.model;

public enum TimelineEventType {
  TASKS,
  DISCUSS,
  PLAYER_DEATH,
  PLAYER_DISCONNECT,
  PLAYER_EXILED
}
