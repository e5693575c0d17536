package com.flamingo.ai.interviewinsights.domain.enums;

/** How adequate the number of analyzed experiences is for drawing conclusions. */
public enum SampleAdequacy {
  EXCELLENT(15),
  GOOD(8),
  ADEQUATE(5),
  MINIMAL(3),
  INSUFFICIENT(0);

  private final int minimumSampleSize;

  SampleAdequacy(int minimumSampleSize) {
    this.minimumSampleSize = minimumSampleSize;
  }

  public int getMinimumSampleSize() {
    return minimumSampleSize;
  }

  /**
   * Returns the best adequacy bucket whose minimum the sample size reaches.
   *
   * @param sampleSize number of analyzed documents
   * @return the adequacy bucket
   */
  public static SampleAdequacy forSampleSize(int sampleSize) {
    for (SampleAdequacy adequacy : values()) {
      if (sampleSize >= adequacy.minimumSampleSize) {
        return adequacy;
      }
    }
    return INSUFFICIENT;
  }
}
