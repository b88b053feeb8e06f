/*
 * どこで: Analytics 設定バインド
 * 何を: ランキング API が省略時に使う件数しきい値と表示件数を保持する
 * なぜ: 集計ロジック自体は既定値を持たず、API 層だけが環境ごとの値を補うため
 */
package com.example.analytics.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "analytics.leaderboard")
@Validated
public record AnalyticsLeaderboardProperties(
    @NotNull @Positive Integer minSharedMatches,
    @NotNull @Positive Integer size,
    @NotNull @Positive Integer minTotalMatches) {}
