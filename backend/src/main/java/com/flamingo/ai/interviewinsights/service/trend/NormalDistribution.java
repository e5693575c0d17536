package com.flamingo.ai.interviewinsights.service.trend;

/** Standard normal distribution functions. */
final class NormalDistribution {

  // Abramowitz and Stegun 7.1.26, absolute error below 1.5e-7
  private static final double P = 0.3275911;
  private static final double A1 = 0.254829592;
  private static final double A2 = -0.284496736;
  private static final double A3 = 1.421413741;
  private static final double A4 = -1.453152027;
  private static final double A5 = 1.061405429;

  private NormalDistribution() {}

  static double cdf(double z) {
    return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
  }

  /** Two-sided p-value of a standard normal test statistic. */
  static double twoSidedPValue(double z) {
    return Math.min(1.0, Math.max(0.0, 2.0 * (1.0 - cdf(Math.abs(z)))));
  }

  static double erf(double x) {
    double sign = Math.signum(x);
    double ax = Math.abs(x);
    double t = 1.0 / (1.0 + P * ax);
    double polynomial = ((((A5 * t + A4) * t + A3) * t + A2) * t + A1) * t;
    return sign * (1.0 - polynomial * Math.exp(-ax * ax));
  }
}
