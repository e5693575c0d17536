package com.flamingo.ai.interviewinsights.domain.enums;

import java.util.List;

/** Kinds of interview rounds recognized in experience reports. */
public enum InterviewRoundType {
  CODING(List.of("coding", "algorithm", "data structure", "leetcode", "hackerrank", "dsa")),
  SYSTEM_DESIGN(List.of("system design", "architecture", "low level design", "high level design")),
  BEHAVIORAL(
      List.of("behavioral", "culture fit", "leadership", "teamwork", "conflict", "leadership principles")),
  TECHNICAL_DISCUSSION(
      List.of("technical discussion", "past projects", "project discussion", "deep dive", "resume"));

  private final List<String> indicators;

  InterviewRoundType(List<String> indicators) {
    this.indicators = indicators;
  }

  /** Normalized tokens that signal this round type. */
  public List<String> getIndicators() {
    return indicators;
  }
}
