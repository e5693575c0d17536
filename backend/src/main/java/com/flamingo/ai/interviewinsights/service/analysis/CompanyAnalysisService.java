package com.flamingo.ai.interviewinsights.service.analysis;

import com.flamingo.ai.interviewinsights.domain.model.CompanyInsights;
import com.flamingo.ai.interviewinsights.domain.model.ExperienceRecord;
import java.util.Collection;
import java.util.SortedMap;

/** Runs the full analysis pipeline for companies. */
public interface CompanyAnalysisService {

  /**
   * Analyzes one company's records in a single isolated run.
   *
   * <p>Malformed records and records of other companies are skipped and tallied in the run
   * metadata; they never fail the run.
   *
   * @param company company to analyze
   * @param records experience records of the company
   * @return the insights of the run
   */
  CompanyInsights analyze(String company, Collection<ExperienceRecord> records);

  /**
   * Groups records by company and analyzes every company concurrently. Blocks until all runs
   * finish.
   *
   * @param records records of any number of companies
   * @return insights per company display name, sorted by name
   */
  SortedMap<String, CompanyInsights> analyzeAll(Collection<ExperienceRecord> records);
}
