package com.flamingo.ai.interviewinsights.domain.enums;

/** Coarse difficulty of a single interview experience. */
public enum DifficultyLevel {
  EASY("3-4 weeks"),
  MEDIUM("4-6 weeks"),
  HARD("6-8 weeks"),
  UNKNOWN("4-6 weeks");

  private final String preparationTimeline;

  DifficultyLevel(String preparationTimeline) {
    this.preparationTimeline = preparationTimeline;
  }

  public String getPreparationTimeline() {
    return preparationTimeline;
  }
}
