/*
 * Where: Analytics ranking rows
 * What: Most frequent value of a column within one group, with its occurrence count
 */
package com.example.analytics.model;

public record ModeCount<T>(long count, T mode) {}
