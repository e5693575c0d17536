package com.flamingo.ai.interviewinsights.service.insights;

import static com.flamingo.ai.interviewinsights.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import com.flamingo.ai.interviewinsights.domain.model.InterviewProcess;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InterviewProcessAnalyzer Tests")
class InterviewProcessAnalyzerTest {

  private final InterviewProcessAnalyzer analyzer = new InterviewProcessAnalyzer();

  @Test
  @DisplayName("Should list round types mentioned in more than 30% of reports")
  void shouldListCommonRounds() {
    InterviewProcess process =
        analyzer.analyze(
            List.of(
                document("d1", "system design", "coding"),
                document("d2", "system design", "leetcode"),
                document("d3", "behavioral"),
                document("d4", "architecture")));

    assertThat(process.commonRounds())
        .containsExactly(
            new InterviewProcess.CommonRound(InterviewRoundType.SYSTEM_DESIGN, 75.0, 3),
            new InterviewProcess.CommonRound(InterviewRoundType.CODING, 50.0, 2));
    assertThat(process.totalRoundTypes()).isEqualTo(3);
    assertThat(process.roundDistribution())
        .containsOnly(
            entry(InterviewRoundType.CODING, 2),
            entry(InterviewRoundType.SYSTEM_DESIGN, 3),
            entry(InterviewRoundType.BEHAVIORAL, 1));
    assertThat(process.processInsight()).isEqualTo("Most interviews include 2 common round types");
  }

  @Test
  @DisplayName("Should describe the process as varied when no round type is common")
  void shouldReportVariedProcess() {
    InterviewProcess process =
        analyzer.analyze(
            List.of(
                document("d1", "coding"),
                document("d2", "behavioral"),
                document("d3", "resume"),
                document("d4", "java")));

    assertThat(process.commonRounds()).isEmpty();
    assertThat(process.totalRoundTypes()).isEqualTo(3);
    assertThat(process.processInsight()).isEqualTo("Varied interview processes");
  }

  @Test
  @DisplayName("Should handle an empty corpus")
  void shouldHandleNoDocuments() {
    InterviewProcess process = analyzer.analyze(List.of());

    assertThat(process.commonRounds()).isEmpty();
    assertThat(process.roundDistribution()).isEmpty();
    assertThat(process.processInsight()).isEqualTo("Varied interview processes");
  }
}
