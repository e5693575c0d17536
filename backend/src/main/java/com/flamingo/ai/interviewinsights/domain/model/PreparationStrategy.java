package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.DifficultyLevel;
import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import java.util.List;
import java.util.Map;

/**
 * Company-level preparation plan derived from the difficulty and round mix of its interviews.
 *
 * @param difficultyFocus most common per-interview difficulty
 * @param timeline suggested preparation timeline
 * @param practiceDistribution share of practice per problem difficulty, in percent
 * @param keyRecommendations general advice for the difficulty focus
 * @param roundDistribution number of documents mentioning each round type
 */
public record PreparationStrategy(
    DifficultyLevel difficultyFocus,
    String timeline,
    Map<DifficultyLevel, Integer> practiceDistribution,
    List<String> keyRecommendations,
    Map<InterviewRoundType, Integer> roundDistribution) {

  public PreparationStrategy {
    practiceDistribution = practiceDistribution == null ? Map.of() : Map.copyOf(practiceDistribution);
    keyRecommendations = keyRecommendations == null ? List.of() : List.copyOf(keyRecommendations);
    roundDistribution = roundDistribution == null ? Map.of() : Map.copyOf(roundDistribution);
  }
}
