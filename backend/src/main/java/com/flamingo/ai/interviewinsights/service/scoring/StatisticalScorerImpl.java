package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.exception.InsufficientDataException;
import com.flamingo.ai.interviewinsights.service.topic.TopicExtractor;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link StatisticalScorer}.
 *
 * <p>Documents are put in canonical key order before any floating point sum, so the scores do not
 * depend on the order in which the corpus is passed in.
 *
 * <p>The weighted frequency is recomputed from the decay-weighted coverage: every document counts
 * with its time-decay weight, so a topic seen only in old reports falls behind one seen in recent
 * reports.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticalScorerImpl implements StatisticalScorer {

  private final DifficultyEstimator difficultyEstimator;
  private final TimeDecayCalculator timeDecayCalculator;
  private final ConfidenceEstimator confidenceEstimator;
  private final DomainTaxonomy taxonomy;
  private final InsightsConfig insightsConfig;
  private final Clock clock;

  @Override
  public Topic scoreTopic(Topic topic, Collection<NormalizedDocument> documents) {
    return scoreTopic(topic, documents, LocalDate.now(clock));
  }

  @Override
  public Topic scoreTopic(
      Topic topic, Collection<NormalizedDocument> documents, LocalDate referenceDate) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(referenceDate, "referenceDate must not be null");

    List<NormalizedDocument> corpus = NormalizedDocument.canonicalOrder(documents);
    List<NormalizedDocument> contributing = new ArrayList<>();
    List<Double> contributions = new ArrayList<>();
    double totalDecay = 0.0;
    double contributingDecay = 0.0;
    for (NormalizedDocument document : corpus) {
      double decay = timeDecayCalculator.weight(document.date(), referenceDate);
      totalDecay += decay;
      int occurrences = TopicExtractor.occurrences(topic, document);
      if (occurrences > 0) {
        contributing.add(document);
        contributingDecay += decay;
        contributions.add(decay * ScoreMath.dampen(occurrences));
      }
    }

    double difficulty = difficultyEstimator.estimate(contributing);
    double relevance = totalDecay > 0.0 ? ScoreMath.clamp01(contributingDecay / totalDecay) : 0.0;
    double weightedFrequency =
        ScoreMath.weightedFrequency(
            relevance * 100.0, taxonomy.weightOf(topic.category()), taxonomy.maxWeight());
    double successCorrelation = successCorrelation(corpus, contributing);
    double confidence = confidence(topic, contributions);

    InsightsConfig.Priority priority = insightsConfig.getPriority();
    Topic scored =
        topic.toBuilder()
            .weightedFrequency(weightedFrequency)
            .difficultyScore(ScoreMath.round(difficulty, 4))
            .timeWeightedRelevance(ScoreMath.round(relevance, 4))
            .successCorrelation(ScoreMath.round(successCorrelation, 4))
            .confidenceScore(ScoreMath.round(confidence, 4))
            .sampleSize(contributing.size())
            .priorityLevel(
                PriorityLevel.classify(
                    weightedFrequency,
                    confidence,
                    priority.getHighThreshold(),
                    priority.getMediumThreshold(),
                    priority.getMinHighConfidence()))
            .build();

    log.debug(
        "Scored topic {}: n={}, weightedFrequency={}, difficulty={}, relevance={}, confidence={},"
            + " priority={}",
        topic.id(),
        contributing.size(),
        String.format("%.2f", weightedFrequency),
        String.format("%.3f", scored.difficultyScore()),
        String.format("%.3f", scored.timeWeightedRelevance()),
        String.format("%.3f", scored.confidenceScore()),
        scored.priorityLevel());
    return scored;
  }

  private double confidence(Topic topic, List<Double> contributions) {
    double max = 0.0;
    for (double contribution : contributions) {
      max = Math.max(max, contribution);
    }
    List<Double> normalized = new ArrayList<>(contributions.size());
    for (double contribution : contributions) {
      normalized.add(max > 0.0 ? contribution / max : 0.0);
    }
    try {
      return confidenceEstimator.estimate(normalized);
    } catch (InsufficientDataException e) {
      log.debug(
          "Topic {} has {} contributing documents, {} required; confidence set to 0",
          topic.id(),
          e.getSampleSize(),
          e.getRequiredSampleSize());
      return 0.0;
    }
  }

  // (P(mention | SUCCESS) - P(mention | FAIL) + 1) / 2
  private static double successCorrelation(
      List<NormalizedDocument> corpus, List<NormalizedDocument> contributing) {
    int successes = countOutcome(corpus, Outcome.SUCCESS);
    int failures = countOutcome(corpus, Outcome.FAIL);
    if (successes == 0 || failures == 0) {
      return 0.5;
    }
    double pSuccess = (double) countOutcome(contributing, Outcome.SUCCESS) / successes;
    double pFail = (double) countOutcome(contributing, Outcome.FAIL) / failures;
    return ScoreMath.clamp01((pSuccess - pFail + 1.0) / 2.0);
  }

  private static int countOutcome(List<NormalizedDocument> documents, Outcome outcome) {
    int count = 0;
    for (NormalizedDocument document : documents) {
      if (document.outcomeRef() == outcome) {
        count++;
      }
    }
    return count;
  }
}
