package com.flamingo.ai.interviewinsights.service.scoring;

/**
 * Two-sided 95% critical values of Student's t-distribution.
 *
 * <p>Exact table values for 1..30, 40, 60 and 120 degrees of freedom. Between table points the
 * value is interpolated linearly in 1/df; beyond 120 it approaches the normal value 1.96.
 */
public final class StudentTDistribution {

  public static final double NORMAL_CRITICAL_975 = 1.959964;

  private static final double[] CRITICAL_975_1_TO_30 = {
    12.706, 4.303, 3.182, 2.776, 2.571, 2.447, 2.365, 2.306, 2.262, 2.228,
    2.201, 2.179, 2.160, 2.145, 2.131, 2.120, 2.110, 2.101, 2.093, 2.086,
    2.080, 2.074, 2.069, 2.064, 2.060, 2.056, 2.052, 2.048, 2.045, 2.042
  };

  private static final int[] SPARSE_DF = {30, 40, 60, 120};
  private static final double[] SPARSE_CRITICAL = {2.042, 2.021, 2.000, 1.980};

  private StudentTDistribution() {}

  /**
   * Returns t such that P(|T| > t) = 0.05 for the given degrees of freedom.
   *
   * @param degreesOfFreedom degrees of freedom, at least 1
   * @return the critical value
   */
  public static double criticalValue95(int degreesOfFreedom) {
    if (degreesOfFreedom < 1) {
      throw new IllegalArgumentException("Degrees of freedom must be positive: " + degreesOfFreedom);
    }
    if (degreesOfFreedom <= 30) {
      return CRITICAL_975_1_TO_30[degreesOfFreedom - 1];
    }
    for (int i = 1; i < SPARSE_DF.length; i++) {
      if (degreesOfFreedom <= SPARSE_DF[i]) {
        return interpolate(
            degreesOfFreedom, SPARSE_DF[i - 1], SPARSE_CRITICAL[i - 1], SPARSE_DF[i], SPARSE_CRITICAL[i]);
      }
    }
    // 1/df -> 0 at infinity
    double lastDf = SPARSE_DF[SPARSE_DF.length - 1];
    double lastValue = SPARSE_CRITICAL[SPARSE_CRITICAL.length - 1];
    double fraction = (1.0 / degreesOfFreedom) / (1.0 / lastDf);
    return NORMAL_CRITICAL_975 + (lastValue - NORMAL_CRITICAL_975) * fraction;
  }

  private static double interpolate(int df, int lowDf, double lowValue, int highDf, double highValue) {
    double x = 1.0 / df;
    double x0 = 1.0 / lowDf;
    double x1 = 1.0 / highDf;
    return lowValue + (highValue - lowValue) * (x - x0) / (x1 - x0);
  }
}
