/*
 * どこで: common のイベント payload 定義
 * 何を: プレイヤー操作テレメトリの JSON 形状を共通レコードとして提供する
 * なぜ: capture 側と analytics 側で同一のペイロード形状を共有するため
 */
package com.example.common.game;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerActionPayload(
    @JsonProperty("Action") Integer action,
    @JsonProperty("Name") String name,
    @JsonProperty("Color") Integer color,
    @JsonProperty("IsDead") boolean isDead,
    @JsonProperty("Disconnected") boolean disconnected) {}
