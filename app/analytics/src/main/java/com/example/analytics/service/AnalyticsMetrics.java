package com.example.analytics.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AnalyticsMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer reduceTimer;
  private final ConcurrentMap<String, Counter> queryFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> skippedEventCounters = new ConcurrentHashMap<>();

  public AnalyticsMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.reduceTimer =
        Timer.builder("analytics.reduce.duration")
            .description("Time spent folding one match into statistics")
            .register(meterRegistry);
  }

  public void recordQueryFailure(String operation) {
    queryFailureCounters
        .computeIfAbsent(operation, this::registerQueryFailureCounter)
        .increment();
  }

  public void recordSkippedEvent(String reason) {
    skippedEventCounters.computeIfAbsent(reason, this::registerSkippedEventCounter).increment();
  }

  public <T> T timeReduce(Supplier<T> reduction) {
    return reduceTimer.record(reduction);
  }

  private Counter registerQueryFailureCounter(String operation) {
    return Counter.builder("analytics.query.failure.total")
        .tags(Tags.of("operation", operation))
        .register(meterRegistry);
  }

  private Counter registerSkippedEventCounter(String reason) {
    return Counter.builder("analytics.event.skipped.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }
}
