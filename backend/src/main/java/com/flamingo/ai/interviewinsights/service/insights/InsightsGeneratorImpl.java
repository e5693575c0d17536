package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.model.Recommendation;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link InsightsGenerator}.
 *
 * <p>priorityScore = w1 * weightedFrequency/100 + w2 * difficulty + w3 * successCorrelation + w4 *
 * trendSignal, where the trend signal is 0.5 plus or minus half the trend strength.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsightsGeneratorImpl implements InsightsGenerator {

  static final Comparator<Recommendation> RANK_ORDER =
      Comparator.comparingDouble(Recommendation::priorityScore)
          .reversed()
          .thenComparing(
              Comparator.comparingDouble((Recommendation r) -> r.topic().confidenceScore())
                  .reversed())
          .thenComparing(r -> r.topic().representativeTerm());

  private final InsightsConfig insightsConfig;
  private final StudyStrategyCatalog strategyCatalog;

  @Override
  public List<Recommendation> generateRecommendations(
      List<Topic> topics, List<TrendResult> trends) {
    if (topics == null || topics.isEmpty()) {
      return List.of();
    }

    Map<String, TrendResult> trendsByTopic = new HashMap<>();
    if (trends != null) {
      for (TrendResult trend : trends) {
        if (trend != null && trend.topicId() != null) {
          trendsByTopic.putIfAbsent(trend.topicId(), trend);
        }
      }
    }

    InsightsConfig.Recommendation config = insightsConfig.getRecommendation();
    List<Recommendation> candidates = new ArrayList<>();
    for (Topic topic : topics) {
      if (topic == null || topic.representativeTerm() == null) {
        continue;
      }
      TrendResult trend = trendsByTopic.get(topic.id());
      candidates.add(
          new Recommendation(
              topic,
              priorityScore(topic, trend, config),
              estimatedHours(topic, config.getStudyHours()),
              strategyCatalog.strategiesFor(topic, trend, config.getLowConfidenceThreshold())));
    }
    candidates.sort(RANK_ORDER);

    Set<String> seen = new HashSet<>();
    List<Recommendation> ranked = new ArrayList<>();
    for (Recommendation candidate : candidates) {
      if (seen.add(candidate.topic().representativeTerm())) {
        ranked.add(candidate);
      }
    }
    if (ranked.size() < candidates.size()) {
      log.debug("Dropped {} duplicate recommendations", candidates.size() - ranked.size());
    }
    return List.copyOf(ranked);
  }

  double priorityScore(Topic topic, TrendResult trend, InsightsConfig.Recommendation config) {
    double score =
        config.getFrequencyWeight() * ScoreMath.clamp01(topic.weightedFrequency() / 100.0)
            + config.getDifficultyWeight() * ScoreMath.clamp01(topic.difficultyScore())
            + config.getSuccessWeight() * ScoreMath.clamp01(topic.successCorrelation())
            + config.getTrendWeight() * trendSignal(trend);
    return ScoreMath.round(ScoreMath.clamp01(score), 4);
  }

  static double trendSignal(TrendResult trend) {
    if (trend == null || trend.direction() == null) {
      return 0.5;
    }
    double strength = ScoreMath.clamp01(trend.strength());
    return switch (trend.direction()) {
      case RISING -> 0.5 + 0.5 * strength;
      case FALLING -> 0.5 - 0.5 * strength;
      case STABLE -> 0.5;
    };
  }

  /**
   * Study hours: base + difficultyHours * difficulty^exponent + hoursPerExtraTerm * (members - 1),
   * capped and rounded to the nearest half hour.
   */
  static double estimatedHours(Topic topic, InsightsConfig.Recommendation.StudyHours curve) {
    int extraTerms = Math.max(0, topic.memberTerms().size() - 1);
    double hours =
        curve.getBaseHours()
            + curve.getDifficultyHours()
                * Math.pow(ScoreMath.clamp01(topic.difficultyScore()), curve.getDifficultyExponent())
            + curve.getHoursPerExtraTerm() * extraTerms;
    return Math.round(Math.min(curve.getMaxHours(), hours) * 2.0) / 2.0;
  }
}
