package com.flamingo.ai.interviewinsights.domain.enums;

/** Direction of a topic's importance over time. */
public enum TrendDirection {
  RISING,
  FALLING,
  STABLE
}
