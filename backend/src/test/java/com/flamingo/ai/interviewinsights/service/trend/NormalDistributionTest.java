package com.flamingo.ai.interviewinsights.service.trend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NormalDistribution Tests")
class NormalDistributionTest {

  @Test
  @DisplayName("Should approximate the standard normal CDF")
  void shouldApproximateCdf() {
    assertThat(NormalDistribution.cdf(0.0)).isCloseTo(0.5, within(1e-7));
    assertThat(NormalDistribution.cdf(1.959964)).isCloseTo(0.975, within(1e-6));
    assertThat(NormalDistribution.cdf(-1.959964)).isCloseTo(0.025, within(1e-6));
  }

  @Test
  @DisplayName("Should compute two-sided p-values")
  void shouldComputeTwoSidedPValues() {
    assertThat(NormalDistribution.twoSidedPValue(0.0)).isCloseTo(1.0, within(1e-7));
    assertThat(NormalDistribution.twoSidedPValue(1.959964)).isCloseTo(0.05, within(1e-6));
    assertThat(NormalDistribution.twoSidedPValue(-1.959964)).isCloseTo(0.05, within(1e-6));
  }
}
