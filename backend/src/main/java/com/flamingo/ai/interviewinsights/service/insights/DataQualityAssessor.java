package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.SampleAdequacy;
import com.flamingo.ai.interviewinsights.domain.model.DataQualityAssessment;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.service.topic.TopicExtractor;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rates how far a run's insights can be trusted.
 *
 * <p>The quality score is the mean of four scores capped at 1: content (average tokens / 100),
 * confidence (mean topic confidence), topic coverage (average topics per document / 5) and sample
 * size (documents / 15).
 */
@Component
public class DataQualityAssessor {

  static final double TOKENS_FOR_FULL_CONTENT = 100.0;
  static final double TOPICS_FOR_FULL_COVERAGE = 5.0;
  static final double DOCUMENTS_FOR_FULL_SAMPLE = 15.0;
  static final double SHORT_DOCUMENT_TOKENS = 40.0;

  public DataQualityAssessment assess(Collection<NormalizedDocument> documents, List<Topic> topics) {
    List<NormalizedDocument> corpus = NormalizedDocument.canonicalOrder(documents);
    List<Topic> scored = topics == null ? List.of() : topics;
    if (corpus.isEmpty()) {
      return DataQualityAssessment.builder()
          .qualityScore(0.0)
          .sampleAdequacy(SampleAdequacy.INSUFFICIENT)
          .confidenceLevel(QualityLevel.VERY_LOW)
          .issues(List.of("No experiences available"))
          .suggestions(List.of("Collect more interview experiences"))
          .build();
    }

    int n = corpus.size();
    long totalTokens = 0;
    long topicMentions = 0;
    for (NormalizedDocument document : corpus) {
      totalTokens += document.tokens().size();
      for (Topic topic : scored) {
        if (TopicExtractor.occurrences(topic, document) > 0) {
          topicMentions++;
        }
      }
    }
    double averageTokens = (double) totalTokens / n;
    double averageTopics = (double) topicMentions / n;
    double meanConfidence =
        scored.stream().mapToDouble(Topic::confidenceScore).average().orElse(0.0);

    double qualityScore =
        (Math.min(averageTokens / TOKENS_FOR_FULL_CONTENT, 1.0)
                + ScoreMath.clamp01(meanConfidence)
                + Math.min(averageTopics / TOPICS_FOR_FULL_COVERAGE, 1.0)
                + Math.min(n / DOCUMENTS_FOR_FULL_SAMPLE, 1.0))
            / 4.0;

    List<String> issues = new ArrayList<>();
    List<String> suggestions = new ArrayList<>();
    if (averageTokens < SHORT_DOCUMENT_TOKENS) {
      issues.add("Short experience descriptions");
      suggestions.add("Collect more detailed interview experiences");
    }
    if (meanConfidence < 0.5) {
      issues.add("Low topic confidence");
      suggestions.add("Collect more experiences mentioning the same topics");
    }
    if (averageTopics < 2.0) {
      issues.add("Few topics per experience");
      suggestions.add("Target more technical interview experiences");
    }
    if (n < SampleAdequacy.ADEQUATE.getMinimumSampleSize()) {
      issues.add("Small sample size");
      suggestions.add("Collect more experiences for statistical significance");
    }

    return DataQualityAssessment.builder()
        .qualityScore(ScoreMath.round(qualityScore, 2))
        .sampleAdequacy(SampleAdequacy.forSampleSize(n))
        .confidenceLevel(qualityLevel(qualityScore))
        .sampleSize(n)
        .averageTokensPerDocument(ScoreMath.round(averageTokens, 1))
        .averageTopicsPerDocument(ScoreMath.round(averageTopics, 1))
        .issues(issues)
        .suggestions(suggestions)
        .build();
  }

  static QualityLevel qualityLevel(double qualityScore) {
    if (qualityScore >= 0.8) {
      return QualityLevel.HIGH;
    } else if (qualityScore >= 0.6) {
      return QualityLevel.MEDIUM;
    } else if (qualityScore >= 0.4) {
      return QualityLevel.LOW;
    } else {
      return QualityLevel.VERY_LOW;
    }
  }
}
