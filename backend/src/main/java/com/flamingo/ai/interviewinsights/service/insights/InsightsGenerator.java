package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.model.Recommendation;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import java.util.List;

/** Fuses scored topics and their trends into ranked study recommendations. */
public interface InsightsGenerator {

  /**
   * Ranks topics by priority score.
   *
   * <p>Ordering is priority score descending, then confidence descending, then representative term
   * ascending. Only the highest ranked topic per representative term is kept.
   *
   * @param topics scored topics of one run
   * @param trends trend results matched to topics by topic id, may be empty
   * @return recommendations in rank order, empty for no topics
   */
  List<Recommendation> generateRecommendations(List<Topic> topics, List<TrendResult> trends);
}
