/*
 * どこで: Analytics API
 * 何を: エラー応答の標準フォーマットを定義する
 */
package com.example.analytics.api;

public record ApiErrorResponse(String code, String message) {}
