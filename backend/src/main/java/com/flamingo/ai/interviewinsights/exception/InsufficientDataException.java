package com.flamingo.ai.interviewinsights.exception;

/** Exception thrown when a statistic needs more samples than are available. */
public class InsufficientDataException extends RuntimeException {

  private final int sampleSize;
  private final int requiredSampleSize;

  public InsufficientDataException(int sampleSize, int requiredSampleSize) {
    super(
        "Sample size "
            + sampleSize
            + " is below the required minimum of "
            + requiredSampleSize);
    this.sampleSize = sampleSize;
    this.requiredSampleSize = requiredSampleSize;
  }

  public int getSampleSize() {
    return sampleSize;
  }

  public int getRequiredSampleSize() {
    return requiredSampleSize;
  }
}
