package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * How a run's topics spread over categories and priority levels.
 *
 * @param totalTopics number of topics
 * @param byCategory topic count and share per category, in category order
 * @param byPriority topic count and share per priority level, in level order
 */
public record TopicDistribution(
    int totalTopics, Map<TopicCategory, Share> byCategory, Map<PriorityLevel, Share> byPriority) {

  public TopicDistribution {
    byCategory =
        byCategory == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byCategory));
    byPriority =
        byPriority == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byPriority));
  }

  /**
   * @param count number of topics
   * @param percentage share of all topics, rounded to one decimal
   */
  public record Share(int count, double percentage) {}
}
