package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Builder;

/**
 * A cluster of related terms representing one interview subject area of one company.
 *
 * <p>Instances are immutable. The statistical fields are zero until the topic has been scored;
 * scoring returns a new instance via {@link #toBuilder()}.
 *
 * @param id stable id derived from the representative term
 * @param companyRef company the topic was extracted for
 * @param representativeTerm the member term that names the cluster
 * @param memberTerms all terms merged into the cluster, sorted
 * @param category subject category of the representative term
 * @param weightedFrequency share of documents referencing the topic scaled by category weight, in
 *     [0,100]
 * @param compositeScore damped tf-idf importance summed over member terms
 * @param documentCount number of documents referencing any member term
 * @param priorityLevel study priority bucket
 * @param confidenceScore statistical reliability in [0,1]
 * @param difficultyScore estimated difficulty in [0,1]
 * @param timeWeightedRelevance decay-weighted share of documents referencing the topic, in [0,1]
 * @param successCorrelation association with successful outcomes in [0,1], 0.5 is neutral
 * @param sampleSize number of contributing documents used for the statistics
 */
@Builder(toBuilder = true)
public record Topic(
    String id,
    String companyRef,
    String representativeTerm,
    SortedSet<String> memberTerms,
    TopicCategory category,
    double weightedFrequency,
    double compositeScore,
    int documentCount,
    PriorityLevel priorityLevel,
    double confidenceScore,
    double difficultyScore,
    double timeWeightedRelevance,
    double successCorrelation,
    int sampleSize) {

  public Topic {
    memberTerms =
        memberTerms == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(memberTerms));
    weightedFrequency = Math.max(0.0, Math.min(100.0, weightedFrequency));
    category = category == null ? TopicCategory.OTHER : category;
    priorityLevel = priorityLevel == null ? PriorityLevel.LOW : priorityLevel;
  }
}
