package com.flamingo.ai.interviewinsights.domain.model;

import java.time.LocalDate;

/**
 * One fixed time window of a topic's historical series.
 *
 * @param start first day of the window
 * @param end first day after the window
 * @param documentCount documents dated inside the window
 * @param value share of those documents referencing the topic, in [0,1]
 */
public record TimeBucket(LocalDate start, LocalDate end, int documentCount, double value) {}
