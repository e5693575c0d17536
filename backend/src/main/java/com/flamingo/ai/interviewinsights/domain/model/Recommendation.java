package com.flamingo.ai.interviewinsights.domain.model;

import java.util.List;

/**
 * A ranked study recommendation for one topic.
 *
 * @param topic the scored topic
 * @param priorityScore combined priority in [0,1]
 * @param estimatedHours suggested study time in hours
 * @param strategies ordered study advice
 */
public record Recommendation(
    Topic topic, double priorityScore, double estimatedHours, List<String> strategies) {

  public Recommendation {
    strategies = strategies == null ? List.of() : List.copyOf(strategies);
  }
}
