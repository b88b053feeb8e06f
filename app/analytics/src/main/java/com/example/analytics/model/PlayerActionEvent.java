package com.example.analytics.model;

import com.example.common.game.PlayerAction;

/** {@code action} is null for codes outside the known table; {@code payload} is the raw JSON. */
public record PlayerActionEvent(
    PlayerAction action, String playerName, long timestamp, String payload)
    implements ClassifiedEvent {}
