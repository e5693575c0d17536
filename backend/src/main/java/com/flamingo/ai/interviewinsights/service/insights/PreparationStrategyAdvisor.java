package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.enums.DifficultyLevel;
import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.PreparationStrategy;
import com.flamingo.ai.interviewinsights.service.scoring.InterviewSignals;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Company-level preparation plan from the difficulty and round mix of its interviews. */
@Component
public class PreparationStrategyAdvisor {

  public PreparationStrategy advise(Collection<NormalizedDocument> documents) {
    Map<DifficultyLevel, Integer> difficultyCounts = new EnumMap<>(DifficultyLevel.class);
    Map<InterviewRoundType, Integer> roundCounts = new EnumMap<>(InterviewRoundType.class);
    for (NormalizedDocument document : NormalizedDocument.canonicalOrder(documents)) {
      DifficultyLevel level = InterviewSignals.difficultyLevel(document.tokens());
      if (level != DifficultyLevel.UNKNOWN) {
        difficultyCounts.merge(level, 1, Integer::sum);
      }
      for (InterviewRoundType type : InterviewSignals.roundTypes(document.tokens())) {
        roundCounts.merge(type, 1, Integer::sum);
      }
    }

    DifficultyLevel focus = dominant(difficultyCounts);
    return new PreparationStrategy(
        focus,
        focus.getPreparationTimeline(),
        practiceDistribution(focus),
        keyRecommendations(focus),
        roundCounts);
  }

  // Most frequent level; ties go to the harder level
  static DifficultyLevel dominant(Map<DifficultyLevel, Integer> counts) {
    DifficultyLevel focus = DifficultyLevel.UNKNOWN;
    int best = 0;
    for (DifficultyLevel level : List.of(DifficultyLevel.HARD, DifficultyLevel.MEDIUM, DifficultyLevel.EASY)) {
      int count = counts.getOrDefault(level, 0);
      if (count > best) {
        best = count;
        focus = level;
      }
    }
    return focus;
  }

  static Map<DifficultyLevel, Integer> practiceDistribution(DifficultyLevel focus) {
    return switch (focus) {
      case HARD -> Map.of(DifficultyLevel.HARD, 50, DifficultyLevel.MEDIUM, 35, DifficultyLevel.EASY, 15);
      case MEDIUM -> Map.of(DifficultyLevel.MEDIUM, 60, DifficultyLevel.HARD, 25, DifficultyLevel.EASY, 15);
      case EASY -> Map.of(DifficultyLevel.EASY, 40, DifficultyLevel.MEDIUM, 50, DifficultyLevel.HARD, 10);
      case UNKNOWN -> Map.of();
    };
  }

  static List<String> keyRecommendations(DifficultyLevel focus) {
    return switch (focus) {
      case HARD ->
          List.of(
              "Focus heavily on advanced algorithms and system design",
              "Practice complex problem-solving patterns",
              "Prepare for multiple rounds of technical interviews");
      case MEDIUM ->
          List.of(
              "Balance breadth and depth in technical preparation",
              "Focus on common algorithm patterns",
              "Practice coding under time pressure");
      case EASY ->
          List.of(
              "Focus on fundamentals and clean code",
              "Practice explaining your thought process",
              "Review basic data structures and algorithms");
      case UNKNOWN -> List.of();
    };
  }
}
