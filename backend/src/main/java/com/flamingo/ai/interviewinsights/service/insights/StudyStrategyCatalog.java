package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.domain.enums.TrendDirection;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.taxonomy.TaxonomyTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Study advice texts for recommendations. */
@Component
@RequiredArgsConstructor
public class StudyStrategyCatalog {

  private static final Map<String, String> GROUP_PRACTICE =
      Map.of(
          "algorithms.dynamic_programming",
          "Practice: Climbing Stairs, House Robber, Coin Change, Longest Common Subsequence",
          "algorithms.searching",
          "Practice: Binary Search, Search in Rotated Sorted Array, Find Peak Element",
          "data_structures.tree",
          "Practice: Binary Tree Inorder Traversal, Maximum Depth of Binary Tree, Validate Binary"
              + " Search Tree",
          "data_structures.graph",
          "Practice: Number of Islands, Course Schedule, Clone Graph",
          "data_structures.hash_table",
          "Practice: Two Sum, Group Anagrams, Longest Consecutive Sequence",
          "system_design.caching",
          "Design exercise: an LRU cache and a distributed cache with eviction and invalidation",
          "system_design.rate_limiting",
          "Design exercise: a token bucket rate limiter shared across API servers");

  private final DomainTaxonomy taxonomy;

  /**
   * Builds the ordered advice for one recommendation: headline, category advice, difficulty advice,
   * trend advice and a caveat when confidence is low.
   */
  List<String> strategiesFor(Topic topic, TrendResult trend, double lowConfidenceThreshold) {
    List<String> strategies = new ArrayList<>();
    strategies.add(headline(topic));
    strategies.add(categoryAdvice(topic));
    strategies.add(difficultyAdvice(topic.difficultyScore()));
    String trendAdvice = trendAdvice(topic, trend);
    if (trendAdvice != null) {
      strategies.add(trendAdvice);
    }
    if (topic.confidenceScore() < lowConfidenceThreshold) {
      strategies.add(
          String.format(
              Locale.ROOT,
              "Low confidence: based on only %d experience(s), treat this signal as tentative",
              topic.sampleSize()));
    }
    return strategies;
  }

  static String headline(Topic topic) {
    String name = topic.representativeTerm();
    double frequency = topic.weightedFrequency();
    return switch (topic.priorityLevel()) {
      case HIGH ->
          String.format(
              Locale.ROOT,
              "CRITICAL: %s has %.1f%% weighted frequency across interviews, prioritize it heavily",
              name,
              frequency);
      case MEDIUM ->
          String.format(
              Locale.ROOT,
              "IMPORTANT: %s is mentioned with %.1f%% weighted frequency, solid preparation needed",
              name,
              frequency);
      case LOW ->
          String.format(
              Locale.ROOT,
              "MODERATE: %s is occasionally mentioned (%.1f%%), good to review",
              name,
              frequency);
    };
  }

  String categoryAdvice(Topic topic) {
    String group =
        taxonomy.lookup(topic.representativeTerm()).map(TaxonomyTerm::groupKey).orElse(null);
    if (group != null && GROUP_PRACTICE.containsKey(group)) {
      return GROUP_PRACTICE.get(group);
    }
    return categoryAdvice(topic.category());
  }

  static String categoryAdvice(TopicCategory category) {
    return switch (category) {
      case SYSTEM_DESIGN ->
          "Study: Designing Data-Intensive Applications, System Design Interview by Alex Xu, and"
              + " practice whiteboarding end-to-end designs";
      case DATA_STRUCTURES ->
          "Implement the structure from scratch and solve problems that rely on its core operations";
      case ALGORITHMS ->
          "Practice recognizing the pattern on timed problems and state the complexity of each"
              + " solution";
      case PROGRAMMING_CONCEPTS ->
          "Review the concept with small code examples and be ready to discuss trade-offs";
      case TECHNOLOGIES ->
          "Refresh hands-on experience and prepare examples of how you used it in past projects";
      case BEHAVIORAL ->
          "Prepare STAR-format stories covering ownership, conflict and impact";
      case OTHER -> "Review how this subject came up in past interviews and prepare examples";
    };
  }

  static String difficultyAdvice(double difficulty) {
    if (difficulty >= 0.66) {
      return "Reported as hard: focus on advanced variants and multi-step problems";
    } else if (difficulty >= 0.33) {
      return "Moderate difficulty: balance fundamentals with medium-level practice";
    } else {
      return "Generally approachable: make sure the fundamentals are solid and fast";
    }
  }

  static String trendAdvice(Topic topic, TrendResult trend) {
    if (trend == null || trend.direction() == TrendDirection.STABLE) {
      return null;
    }
    String qualifier = trend.significant() ? "significantly" : "slightly";
    String change = trend.direction() == TrendDirection.RISING ? "more" : "less";
    String label = trend.direction() == TrendDirection.RISING ? "Trending up" : "Trending down";
    return String.format(
        "%s: %s is %s %s common in recent interviews",
        label, topic.representativeTerm(), qualifier, change);
  }
}
