package com.flamingo.ai.interviewinsights.domain.enums;

/** Study priority bucket of a topic. */
public enum PriorityLevel {
  HIGH,
  MEDIUM,
  LOW;

  /**
   * Buckets a topic by its weighted frequency and confidence.
   *
   * <p>HIGH requires both a high normalized frequency and enough confidence. A topic with high
   * frequency but too little confidence drops to MEDIUM.
   *
   * @param weightedFrequency weighted frequency in [0,100]
   * @param confidence confidence score in [0,1]
   * @param highThreshold minimum normalized frequency for HIGH
   * @param mediumThreshold minimum normalized frequency for MEDIUM
   * @param minHighConfidence minimum confidence for HIGH
   * @return the priority level
   */
  public static PriorityLevel classify(
      double weightedFrequency,
      double confidence,
      double highThreshold,
      double mediumThreshold,
      double minHighConfidence) {
    double normalized = weightedFrequency / 100.0;
    if (normalized >= highThreshold && confidence >= minHighConfidence) {
      return HIGH;
    } else if (normalized >= mediumThreshold) {
      return MEDIUM;
    } else {
      return LOW;
    }
  }
}
