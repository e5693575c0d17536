package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.SampleAdequacy;
import java.util.List;
import lombok.Builder;

/** How far the insights of a run can be trusted, with suggestions for improving the data. */
@Builder
public record DataQualityAssessment(
    double qualityScore,
    SampleAdequacy sampleAdequacy,
    QualityLevel confidenceLevel,
    int sampleSize,
    double averageTokensPerDocument,
    double averageTopicsPerDocument,
    List<String> issues,
    List<String> suggestions) {

  public DataQualityAssessment {
    issues = issues == null ? List.of() : List.copyOf(issues);
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }
}
