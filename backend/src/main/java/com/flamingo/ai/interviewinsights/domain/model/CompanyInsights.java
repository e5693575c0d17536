package com.flamingo.ai.interviewinsights.domain.model;

import java.util.List;

/**
 * Complete result of one company analysis run.
 *
 * @param metadata run bookkeeping
 * @param topics scored topics, ordered by weighted frequency
 * @param trends trend results keyed implicitly by topic id
 * @param recommendations ranked recommendations
 * @param dataQuality data quality assessment
 * @param preparationStrategy company-level preparation plan
 * @param successFactors topics separating successful from failed interviews
 * @param topicDistribution topic counts per category and priority level
 * @param interviewProcess common interview round types
 */
public record CompanyInsights(
    RunMetadata metadata,
    List<Topic> topics,
    List<TrendResult> trends,
    List<Recommendation> recommendations,
    DataQualityAssessment dataQuality,
    PreparationStrategy preparationStrategy,
    SuccessFactors successFactors,
    TopicDistribution topicDistribution,
    InterviewProcess interviewProcess) {

  public CompanyInsights {
    topics = topics == null ? List.of() : List.copyOf(topics);
    trends = trends == null ? List.of() : List.copyOf(trends);
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
  }
}
