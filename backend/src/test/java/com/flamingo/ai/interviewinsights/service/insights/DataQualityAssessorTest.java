package com.flamingo.ai.interviewinsights.service.insights;

import static com.flamingo.ai.interviewinsights.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.SampleAdequacy;
import com.flamingo.ai.interviewinsights.domain.model.DataQualityAssessment;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DataQualityAssessor Tests")
class DataQualityAssessorTest {

  private final DataQualityAssessor assessor = new DataQualityAssessor();

  private static Topic topic(String term, double confidence) {
    return Topic.builder()
        .id(term)
        .representativeTerm(term)
        .memberTerms(new TreeSet<>(List.of(term)))
        .confidenceScore(confidence)
        .build();
  }

  @Test
  @DisplayName("Should report insufficient data for an empty corpus")
  void shouldReportInsufficientDataForEmptyCorpus() {
    DataQualityAssessment assessment = assessor.assess(List.of(), List.of());

    assertThat(assessment.qualityScore()).isZero();
    assertThat(assessment.sampleAdequacy()).isEqualTo(SampleAdequacy.INSUFFICIENT);
    assertThat(assessment.confidenceLevel()).isEqualTo(QualityLevel.VERY_LOW);
    assertThat(assessment.issues()).containsExactly("No experiences available");
    assertThat(assessment.suggestions()).containsExactly("Collect more interview experiences");
  }

  @Test
  @DisplayName("Should rate a large, detailed, confident corpus as high quality")
  void shouldRateRichCorpusHigh() {
    List<String> tokens = new ArrayList<>(List.of("t1", "t2", "t3", "t4", "t5"));
    tokens.addAll(Collections.nCopies(95, "filler"));
    List<NormalizedDocument> documents = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      documents.add(document("d" + i, tokens.toArray(String[]::new)));
    }
    List<Topic> topics =
        List.of(topic("t1", 1.0), topic("t2", 1.0), topic("t3", 1.0), topic("t4", 1.0),
            topic("t5", 1.0));

    DataQualityAssessment assessment = assessor.assess(documents, topics);

    assertThat(assessment.qualityScore()).isEqualTo(1.0);
    assertThat(assessment.sampleAdequacy()).isEqualTo(SampleAdequacy.EXCELLENT);
    assertThat(assessment.confidenceLevel()).isEqualTo(QualityLevel.HIGH);
    assertThat(assessment.sampleSize()).isEqualTo(15);
    assertThat(assessment.averageTokensPerDocument()).isEqualTo(100.0);
    assertThat(assessment.averageTopicsPerDocument()).isEqualTo(5.0);
    assertThat(assessment.issues()).isEmpty();
    assertThat(assessment.suggestions()).isEmpty();
  }

  @Test
  @DisplayName("Should flag short, sparse and small corpora")
  void shouldFlagWeakCorpus() {
    List<NormalizedDocument> documents =
        List.of(document("d1", "t1", "x"), document("d2", "x"), document("d3", "t1"));

    DataQualityAssessment assessment = assessor.assess(documents, List.of(topic("t1", 0.0)));

    assertThat(assessment.sampleAdequacy()).isEqualTo(SampleAdequacy.MINIMAL);
    assertThat(assessment.confidenceLevel()).isEqualTo(QualityLevel.VERY_LOW);
    assertThat(assessment.averageTopicsPerDocument()).isEqualTo(0.7);
    assertThat(assessment.issues())
        .containsExactly(
            "Short experience descriptions",
            "Low topic confidence",
            "Few topics per experience",
            "Small sample size");
    assertThat(assessment.suggestions()).hasSize(4);
  }

  @Test
  @DisplayName("Should map quality scores to confidence levels")
  void shouldMapQualityLevels() {
    assertThat(DataQualityAssessor.qualityLevel(0.8)).isEqualTo(QualityLevel.HIGH);
    assertThat(DataQualityAssessor.qualityLevel(0.6)).isEqualTo(QualityLevel.MEDIUM);
    assertThat(DataQualityAssessor.qualityLevel(0.4)).isEqualTo(QualityLevel.LOW);
    assertThat(DataQualityAssessor.qualityLevel(0.39)).isEqualTo(QualityLevel.VERY_LOW);
  }
}
