package com.flamingo.ai.interviewinsights.service.topic;

import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import java.util.SortedSet;

/**
 * Corpus-level score of one candidate term.
 *
 * @param term canonical term text
 * @param category primary category
 * @param weight category multiplier
 * @param groupKey taxonomy topic group, null for uncategorized terms
 * @param canonical whether the term is the canonical term of its group
 * @param documents keys of documents containing the term
 * @param importance damped tf-idf times category weight
 */
record TermScore(
    String term,
    TopicCategory category,
    double weight,
    String groupKey,
    boolean canonical,
    SortedSet<String> documents,
    double importance) {

  int documentFrequency() {
    return documents.size();
  }
}
