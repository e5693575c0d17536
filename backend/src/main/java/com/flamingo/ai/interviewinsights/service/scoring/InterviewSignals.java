package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.domain.enums.DifficultyLevel;
import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Difficulty and round signals read from a document's tokens. */
public final class InterviewSignals {

  private static final Set<String> HARD_WORDS =
      Set.of(
          "hard", "difficult", "challenging", "tough", "complex", "advanced", "struggled",
          "tricky", "brutal", "intense", "grueling", "gruelling", "stuck");
  private static final Set<String> MEDIUM_WORDS =
      Set.of("medium", "moderate", "intermediate", "standard", "average", "decent", "manageable");
  private static final Set<String> EASY_WORDS =
      Set.of("easy", "simple", "basic", "straightforward", "trivial", "beginner", "smooth");

  private static final Map<String, Integer> ORDINALS =
      Map.of(
          "first", 1, "second", 2, "third", 3, "fourth", 4, "fifth", 5, "sixth", 6,
          "seventh", 7, "final", 0, "last", 0);

  private static final Set<String> ROUND_WORDS = Set.of("round", "rounds");
  private static final Set<String> ROUND_EVENTS = Set.of("onsite", "phone screen", "online assessment", "oa");
  private static final Pattern NUMBER = Pattern.compile("\\d{1,2}");
  private static final int MAX_ROUNDS = 10;

  private InterviewSignals() {}

  /**
   * Difficulty suggested by indicator words: hard counts 1, medium 0.5, easy 0.
   *
   * @param tokens document tokens
   * @return score in [0,1], 0.5 when the document has no indicator words
   */
  public static double keywordDifficulty(List<String> tokens) {
    int[] counts = indicatorCounts(tokens);
    int total = counts[0] + counts[1] + counts[2];
    if (total == 0) {
      return 0.5;
    }
    return (counts[2] + 0.5 * counts[1]) / total;
  }

  /**
   * Dominant difficulty level of a document; ties resolve to the harder level.
   *
   * @param tokens document tokens
   * @return the level, UNKNOWN without indicator words
   */
  public static DifficultyLevel difficultyLevel(List<String> tokens) {
    int[] counts = indicatorCounts(tokens);
    if (counts[0] + counts[1] + counts[2] == 0) {
      return DifficultyLevel.UNKNOWN;
    }
    if (counts[2] >= counts[1] && counts[2] >= counts[0]) {
      return DifficultyLevel.HARD;
    } else if (counts[1] >= counts[0]) {
      return DifficultyLevel.MEDIUM;
    } else {
      return DifficultyLevel.EASY;
    }
  }

  /**
   * Estimates how many interview rounds a document describes.
   *
   * <p>Uses the largest round number mentioned ("round 3", "4 rounds", "third round"), falling back
   * to the number of round mentions and round events such as an onsite or phone screen.
   *
   * @param tokens document tokens
   * @return estimated rounds, capped at 10
   */
  public static int roundCount(List<String> tokens) {
    int highestNumbered = 0;
    int mentions = 0;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (ROUND_EVENTS.contains(token)) {
        mentions++;
      }
      if (!ROUND_WORDS.contains(token)) {
        continue;
      }
      mentions++;
      highestNumbered = Math.max(highestNumbered, numberAt(tokens, i + 1));
      highestNumbered = Math.max(highestNumbered, numberAt(tokens, i - 1));
    }
    return Math.min(MAX_ROUNDS, Math.max(highestNumbered, mentions));
  }

  /**
   * Round types mentioned in a document.
   *
   * @param tokens document tokens
   * @return the detected round types
   */
  public static Set<InterviewRoundType> roundTypes(List<String> tokens) {
    Set<InterviewRoundType> types = EnumSet.noneOf(InterviewRoundType.class);
    Set<String> present = Set.copyOf(tokens);
    for (InterviewRoundType type : InterviewRoundType.values()) {
      for (String indicator : type.getIndicators()) {
        if (present.contains(indicator)) {
          types.add(type);
          break;
        }
      }
    }
    return types;
  }

  private static int numberAt(List<String> tokens, int index) {
    if (index < 0 || index >= tokens.size()) {
      return 0;
    }
    String token = tokens.get(index);
    if (NUMBER.matcher(token).matches()) {
      return Math.min(MAX_ROUNDS, Integer.parseInt(token));
    }
    return ORDINALS.getOrDefault(token, 0);
  }

  // [easy, medium, hard]
  private static int[] indicatorCounts(List<String> tokens) {
    int[] counts = new int[3];
    for (String token : tokens) {
      if (HARD_WORDS.contains(token)) {
        counts[2]++;
      } else if (MEDIUM_WORDS.contains(token)) {
        counts[1]++;
      } else if (EASY_WORDS.contains(token)) {
        counts[0]++;
      }
    }
    return counts;
  }
}
