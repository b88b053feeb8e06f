/*
 * どこで: Analytics API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: ID やロール指定の不正を 400 へ正規化するため
 */
package com.example.analytics.api;

public class InvalidAnalyticsRequestException extends RuntimeException {
  public InvalidAnalyticsRequestException(String message) {
    super(message);
  }
}
