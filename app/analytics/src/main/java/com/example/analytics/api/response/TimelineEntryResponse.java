package com.example.analytics.api.response;

import com.example.analytics.model.TimelineEntry;

public record TimelineEntryResponse(String type, long offsetSeconds, String data) {

  public static TimelineEntryResponse from(TimelineEntry entry) {
    return new TimelineEntryResponse(
        entry.type().name(), entry.offset().toSeconds(), entry.data());
  }
}
