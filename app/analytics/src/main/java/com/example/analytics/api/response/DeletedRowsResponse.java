package com.example.analytics.api.response;

public record DeletedRowsResponse(int deleted) {}
