package com.flamingo.ai.interviewinsights.domain.enums;

import java.util.Locale;

/** Result of the interview process reported in an experience record. */
public enum Outcome {
  /** Candidate received an offer or cleared the process. */
  SUCCESS,

  /** Candidate was rejected. */
  FAIL,

  /** Outcome not reported. */
  UNKNOWN;

  /**
   * Maps a collector-supplied outcome label onto the tri-state outcome.
   *
   * @param label free-form label such as "offer", "rejected" or "selected"
   * @return the matching outcome, {@link #UNKNOWN} for null or unrecognized labels
   */
  public static Outcome fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return UNKNOWN;
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "success", "offer", "selected", "accepted", "hired", "passed" -> SUCCESS;
      case "fail", "failed", "rejected", "reject", "declined", "not selected" -> FAIL;
      default -> UNKNOWN;
    };
  }
}
