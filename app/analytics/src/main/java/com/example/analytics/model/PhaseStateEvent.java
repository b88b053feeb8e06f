package com.example.analytics.model;

import com.example.common.game.GamePhase;

/** {@code phase} is null when the code is not a known phase. */
public record PhaseStateEvent(GamePhase phase, String code, long timestamp)
    implements ClassifiedEvent {}
