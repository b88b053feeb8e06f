/*
 * Where: Analytics domain model
 * What: Telemetry event decoded once at the classifier boundary
 * Why: Consumers branch on the variant instead of re-reading raw payloads
 */
package com.example.analytics.model;

public sealed interface ClassifiedEvent permits PhaseStateEvent, PlayerActionEvent {

  /** Absolute event time in epoch seconds. */
  long timestamp();
}
