package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import java.util.List;

/**
 * Topics that separate successful from failed interviews.
 *
 * @param successfulCount documents with outcome SUCCESS
 * @param unsuccessfulCount documents with outcome FAIL
 * @param unknownCount documents without a known outcome
 * @param successPatterns topics more common in successful interviews
 * @param failurePatterns topics more common in failed interviews
 * @param confidence MEDIUM when any pattern was found, LOW otherwise
 */
public record SuccessFactors(
    int successfulCount,
    int unsuccessfulCount,
    int unknownCount,
    List<OutcomePattern> successPatterns,
    List<OutcomePattern> failurePatterns,
    QualityLevel confidence) {

  public SuccessFactors {
    successPatterns = successPatterns == null ? List.of() : List.copyOf(successPatterns);
    failurePatterns = failurePatterns == null ? List.of() : List.copyOf(failurePatterns);
    confidence = confidence == null ? QualityLevel.LOW : confidence;
  }
}
