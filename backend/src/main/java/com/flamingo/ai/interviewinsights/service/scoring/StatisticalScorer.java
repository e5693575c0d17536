package com.flamingo.ai.interviewinsights.service.scoring;

import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import java.time.LocalDate;
import java.util.Collection;

/** Computes difficulty, time-decayed relevance, outcome correlation and confidence of topics. */
public interface StatisticalScorer {

  /**
   * Scores a topic against its company corpus, using today's date from the configured clock as the
   * reference date.
   *
   * @param topic topic to score
   * @param documents the whole company corpus
   * @return a new topic carrying the statistics
   */
  Topic scoreTopic(Topic topic, Collection<NormalizedDocument> documents);

  /**
   * Scores a topic against its company corpus.
   *
   * @param topic topic to score
   * @param documents the whole company corpus
   * @param referenceDate date document ages are measured from
   * @return a new topic carrying the statistics
   */
  Topic scoreTopic(Topic topic, Collection<NormalizedDocument> documents, LocalDate referenceDate);
}
