package com.flamingo.ai.interviewinsights.service.topic;

import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Per-term, per-document occurrence counts for a batch of documents.
 *
 * <p>Only integer counts are accumulated, and {@link #merge} is a plain map union, so merging is
 * commutative and associative. Floating point scores are derived later from the sorted views,
 * which keeps the final result independent of batch order.
 */
final class TermStatistics {

  private static final TermStatistics EMPTY = new TermStatistics(Map.of(), Set.of());

  private final Map<String, Map<String, Integer>> termCounts;
  private final Set<String> documents;

  private TermStatistics(Map<String, Map<String, Integer>> termCounts, Set<String> documents) {
    this.termCounts = termCounts;
    this.documents = documents;
  }

  static TermStatistics empty() {
    return EMPTY;
  }

  /**
   * Counts candidate terms of one batch.
   *
   * @param batch documents of the batch
   * @param isCandidate filter for tokens that may become topic terms
   * @return the batch statistics
   */
  static TermStatistics collect(List<NormalizedDocument> batch, Predicate<String> isCandidate) {
    Map<String, Map<String, Integer>> counts = new HashMap<>();
    Set<String> documents = new HashSet<>();
    for (NormalizedDocument document : batch) {
      if (document == null) {
        continue;
      }
      String key = document.key();
      documents.add(key);
      for (String token : document.tokens()) {
        if (isCandidate.test(token)) {
          counts.computeIfAbsent(token, k -> new HashMap<>()).merge(key, 1, Integer::sum);
        }
      }
    }
    return new TermStatistics(counts, documents);
  }

  /** Union of two statistics; counts of the same term in the same document add up. */
  TermStatistics merge(TermStatistics other) {
    if (this.documents.isEmpty() && this.termCounts.isEmpty()) {
      return other;
    }
    if (other.documents.isEmpty() && other.termCounts.isEmpty()) {
      return this;
    }
    Map<String, Map<String, Integer>> merged = new HashMap<>();
    for (TermStatistics source : List.of(this, other)) {
      source.termCounts.forEach(
          (term, perDocument) -> {
            Map<String, Integer> target = merged.computeIfAbsent(term, k -> new HashMap<>());
            perDocument.forEach((doc, count) -> target.merge(doc, count, Integer::sum));
          });
    }
    Set<String> documents = new HashSet<>(this.documents);
    documents.addAll(other.documents);
    return new TermStatistics(merged, documents);
  }

  int totalDocuments() {
    return documents.size();
  }

  Set<String> terms() {
    return Collections.unmodifiableSet(termCounts.keySet());
  }

  int documentFrequency(String term) {
    return termCounts.getOrDefault(term, Map.of()).size();
  }

  /** Occurrence counts of a term keyed by document, in document-key order. */
  SortedMap<String, Integer> countsFor(String term) {
    return new TreeMap<>(termCounts.getOrDefault(term, Map.of()));
  }
}
