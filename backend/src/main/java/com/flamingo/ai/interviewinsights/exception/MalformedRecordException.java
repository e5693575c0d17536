package com.flamingo.ai.interviewinsights.exception;

/** Exception thrown when an experience record lacks the fields an analysis needs. */
public class MalformedRecordException extends RuntimeException {

  private final String recordId;
  private final String reason;

  public MalformedRecordException(String recordId, String reason) {
    super("Malformed experience record " + recordId + ": " + reason);
    this.recordId = recordId;
    this.reason = reason;
  }

  public String getRecordId() {
    return recordId;
  }

  /** Short machine-friendly reason, used as a tally key. */
  public String getReason() {
    return reason;
  }
}
