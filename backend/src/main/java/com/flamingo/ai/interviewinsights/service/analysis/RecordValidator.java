package com.flamingo.ai.interviewinsights.service.analysis;

import com.flamingo.ai.interviewinsights.domain.model.ExperienceRecord;
import com.flamingo.ai.interviewinsights.exception.MalformedRecordException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Checks that an experience record carries what a company analysis needs. */
@Component
public class RecordValidator {

  public static final String NULL_RECORD = "null_record";
  public static final String BLANK_COMPANY = "blank_company";
  public static final String MISSING_DATE = "missing_date";
  public static final String BLANK_TEXT = "blank_text";
  public static final String COMPANY_MISMATCH = "company_mismatch";

  /**
   * Validates a record for an analysis of {@code company}.
   *
   * @param record the record
   * @param company company being analyzed
   * @throws MalformedRecordException with one of the reason constants of this class
   */
  public void validate(ExperienceRecord record, String company) {
    if (record == null) {
      throw new MalformedRecordException(null, NULL_RECORD);
    }
    if (record.company() == null || record.company().isBlank()) {
      throw new MalformedRecordException(record.id(), BLANK_COMPANY);
    }
    if (record.date() == null) {
      throw new MalformedRecordException(record.id(), MISSING_DATE);
    }
    if (record.rawText() == null || record.rawText().isBlank()) {
      throw new MalformedRecordException(record.id(), BLANK_TEXT);
    }
    if (!companyKey(record.company()).equals(companyKey(company))) {
      throw new MalformedRecordException(record.id(), COMPANY_MISMATCH);
    }
  }

  /** Grouping key of a company name: trimmed and lowercased. */
  public static String companyKey(String company) {
    return company == null ? "" : company.trim().toLowerCase(Locale.ROOT);
  }
}
