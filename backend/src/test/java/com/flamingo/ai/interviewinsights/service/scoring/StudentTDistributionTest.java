package com.flamingo.ai.interviewinsights.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StudentTDistribution Tests")
class StudentTDistributionTest {

  @Test
  @DisplayName("Should return table values for small degrees of freedom")
  void shouldReturnTableValues() {
    assertThat(StudentTDistribution.criticalValue95(1)).isEqualTo(12.706);
    assertThat(StudentTDistribution.criticalValue95(2)).isEqualTo(4.303);
    assertThat(StudentTDistribution.criticalValue95(30)).isEqualTo(2.042);
    assertThat(StudentTDistribution.criticalValue95(60)).isCloseTo(2.000, within(1e-9));
    assertThat(StudentTDistribution.criticalValue95(120)).isCloseTo(1.980, within(1e-9));
  }

  @Test
  @DisplayName("Should interpolate between table points")
  void shouldInterpolate() {
    double value = StudentTDistribution.criticalValue95(35);

    assertThat(value).isBetween(2.021, 2.042);
  }

  @Test
  @DisplayName("Should approach the normal critical value for large samples")
  void shouldApproachNormalValue() {
    assertThat(StudentTDistribution.criticalValue95(1_000)).isBetween(1.959964, 1.980);
    assertThat(StudentTDistribution.criticalValue95(1_000_000))
        .isCloseTo(StudentTDistribution.NORMAL_CRITICAL_975, within(1e-4));
  }

  @Test
  @DisplayName("Should decrease monotonically with degrees of freedom")
  void shouldDecreaseMonotonically() {
    for (int df = 1; df < 200; df++) {
      assertThat(StudentTDistribution.criticalValue95(df + 1))
          .isLessThanOrEqualTo(StudentTDistribution.criticalValue95(df));
    }
  }

  @Test
  @DisplayName("Should reject non-positive degrees of freedom")
  void shouldRejectNonPositiveDegreesOfFreedom() {
    assertThatThrownBy(() -> StudentTDistribution.criticalValue95(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
