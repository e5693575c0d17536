package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.OutcomePattern;
import com.flamingo.ai.interviewinsights.domain.model.SuccessFactors;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.service.topic.TopicExtractor;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Finds topics whose mention rate differs between successful and failed interviews by more than
 * {@link #MIN_RATE_DIFFERENCE}. Needs at least {@link #MIN_OUTCOME_SAMPLES} documents of each
 * outcome; below that only the sample sizes are reported.
 */
@Component
public class SuccessFactorAnalyzer {

  static final int MIN_OUTCOME_SAMPLES = 2;
  static final double MIN_RATE_DIFFERENCE = 0.3;

  private static final Comparator<OutcomePattern> PATTERN_ORDER =
      Comparator.comparingDouble(OutcomePattern::differencePercent)
          .reversed()
          .thenComparing(OutcomePattern::representativeTerm);

  public SuccessFactors analyze(Collection<NormalizedDocument> documents, List<Topic> topics) {
    List<NormalizedDocument> successful = new ArrayList<>();
    List<NormalizedDocument> failed = new ArrayList<>();
    int unknown = 0;
    for (NormalizedDocument document : NormalizedDocument.canonicalOrder(documents)) {
      switch (document.outcomeRef()) {
        case SUCCESS -> successful.add(document);
        case FAIL -> failed.add(document);
        case UNKNOWN -> unknown++;
      }
    }

    List<OutcomePattern> successPatterns = new ArrayList<>();
    List<OutcomePattern> failurePatterns = new ArrayList<>();
    if (successful.size() >= MIN_OUTCOME_SAMPLES
        && failed.size() >= MIN_OUTCOME_SAMPLES
        && topics != null) {
      for (Topic topic : topics) {
        double successRate = mentionRate(topic, successful);
        double failureRate = mentionRate(topic, failed);
        if (successRate - failureRate > MIN_RATE_DIFFERENCE) {
          successPatterns.add(pattern(topic, successRate, failureRate));
        } else if (failureRate - successRate > MIN_RATE_DIFFERENCE) {
          failurePatterns.add(pattern(topic, failureRate, successRate));
        }
      }
      successPatterns.sort(PATTERN_ORDER);
      failurePatterns.sort(PATTERN_ORDER);
    }

    QualityLevel confidence =
        successPatterns.isEmpty() && failurePatterns.isEmpty()
            ? QualityLevel.LOW
            : QualityLevel.MEDIUM;
    return new SuccessFactors(
        successful.size(), failed.size(), unknown, successPatterns, failurePatterns, confidence);
  }

  private static double mentionRate(Topic topic, List<NormalizedDocument> documents) {
    int mentions = 0;
    for (NormalizedDocument document : documents) {
      if (TopicExtractor.occurrences(topic, document) > 0) {
        mentions++;
      }
    }
    return (double) mentions / documents.size();
  }

  private static OutcomePattern pattern(Topic topic, double rate, double otherRate) {
    return new OutcomePattern(
        topic.id(),
        topic.representativeTerm(),
        ScoreMath.round(rate * 100.0, 1),
        ScoreMath.round((rate - otherRate) * 100.0, 1));
  }
}
