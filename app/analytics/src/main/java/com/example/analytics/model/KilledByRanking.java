package com.example.analytics.model;

public record KilledByRanking(
    long userId, long imposterId, long deaths, long encounters, double deathRate) {}
