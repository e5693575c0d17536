package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shape of a company's interview process.
 *
 * @param commonRounds round types reported in more than 30% of interviews, most frequent first
 * @param totalRoundTypes number of distinct round types seen
 * @param processInsight one-line summary
 * @param roundDistribution documents mentioning each round type
 */
public record InterviewProcess(
    List<CommonRound> commonRounds,
    int totalRoundTypes,
    String processInsight,
    Map<InterviewRoundType, Integer> roundDistribution) {

  public InterviewProcess {
    commonRounds = commonRounds == null ? List.of() : List.copyOf(commonRounds);
    roundDistribution =
        roundDistribution == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(roundDistribution));
  }

  /**
   * @param roundType the round type
   * @param frequencyPercent share of interviews reporting it, rounded to one decimal
   * @param count number of interviews reporting it
   */
  public record CommonRound(InterviewRoundType roundType, double frequencyPercent, int count) {}
}
