/*
 * Where: Analytics domain model
 * What: Snapshot of one users_games row (one user's outcome in one match)
 */
package com.example.analytics.model;

public record UserMatchRecord(
    long userId,
    long guildId,
    long matchId,
    String playerName,
    int playerColor,
    int playerRole,
    boolean playerWon) {}
