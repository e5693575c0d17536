package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Difficulty of a topic estimated from the documents that mention it.
 *
 * <p>Weighted blend of four sub-scores, each averaged over the documents and clamped to [0,1]:
 * indicator words, number of rounds, technical depth and failure share.
 */
@Component
@RequiredArgsConstructor
public class DifficultyEstimator {

  private final DomainTaxonomy taxonomy;
  private final InsightsConfig insightsConfig;

  /**
   * @param documents contributing documents in canonical order
   * @return difficulty in [0,1], 0 for no documents
   */
  public double estimate(List<NormalizedDocument> documents) {
    if (documents.isEmpty()) {
      return 0.0;
    }
    InsightsConfig.Scoring.Difficulty config = insightsConfig.getScoring().getDifficulty();

    double keyword = 0.0;
    double rounds = 0.0;
    double depth = 0.0;
    int successes = 0;
    int failures = 0;
    for (NormalizedDocument document : documents) {
      keyword += InterviewSignals.keywordDifficulty(document.tokens());
      rounds +=
          ScoreMath.clamp01(
              (double) InterviewSignals.roundCount(document.tokens()) / config.getSaturationRounds());
      depth += ScoreMath.clamp01((double) distinctTaxonomyTerms(document) / config.getDepthSaturationTerms());
      if (document.outcomeRef() == Outcome.SUCCESS) {
        successes++;
      } else if (document.outcomeRef() == Outcome.FAIL) {
        failures++;
      }
    }
    int n = documents.size();
    double failureShare = successes + failures == 0 ? 0.5 : (double) failures / (successes + failures);

    double score =
        config.getKeywordWeight() * ScoreMath.clamp01(keyword / n)
            + config.getRoundWeight() * ScoreMath.clamp01(rounds / n)
            + config.getDepthWeight() * ScoreMath.clamp01(depth / n)
            + config.getOutcomeWeight() * failureShare;
    return ScoreMath.clamp01(score);
  }

  private int distinctTaxonomyTerms(NormalizedDocument document) {
    Set<String> terms = new HashSet<>();
    for (String token : document.tokens()) {
      if (taxonomy.contains(token)) {
        terms.add(token);
      }
    }
    return terms.size();
  }
}
