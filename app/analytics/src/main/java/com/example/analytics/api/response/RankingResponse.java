package com.example.analytics.api.response;

import java.util.List;

public record RankingResponse<T>(String ranking, long guildId, List<T> rows) {}
