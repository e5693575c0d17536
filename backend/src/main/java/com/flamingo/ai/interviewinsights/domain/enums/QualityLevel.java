package com.flamingo.ai.interviewinsights.domain.enums;

/** Overall confidence level of a company's data set. */
public enum QualityLevel {
  HIGH,
  MEDIUM,
  LOW,
  VERY_LOW
}
