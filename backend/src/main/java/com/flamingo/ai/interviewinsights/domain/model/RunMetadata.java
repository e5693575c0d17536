package com.flamingo.ai.interviewinsights.domain.model;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Bookkeeping for one (company, run) analysis.
 *
 * @param runId unique id of the run
 * @param company analyzed company
 * @param referenceDate date ages are measured from
 * @param recordsReceived records handed to the run
 * @param recordsAnalyzed records that passed validation
 * @param malformedRecordsSkipped records skipped as malformed
 * @param skipReasons skipped record count per reason
 */
public record RunMetadata(
    UUID runId,
    String company,
    LocalDate referenceDate,
    int recordsReceived,
    int recordsAnalyzed,
    int malformedRecordsSkipped,
    Map<String, Integer> skipReasons) {

  public RunMetadata {
    skipReasons = skipReasons == null ? Map.of() : Map.copyOf(skipReasons);
  }
}
