package com.flamingo.ai.interviewinsights.service.topic;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups related terms into topic clusters using single-linkage clustering.
 *
 * <p>Two terms are linked when any of these holds:
 *
 * <ol>
 *   <li>they belong to the same taxonomy topic group
 *   <li>they share a light suffix-stripped stem of at least three characters
 *   <li>they are in the same category, each occurs in at least {@code minCooccurrenceDocuments}
 *       documents, and the Jaccard similarity of their document sets reaches {@code
 *       cooccurrenceThreshold}
 * </ol>
 *
 * Links are transitive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TermClusterer {

  private static final int MIN_STEM_LENGTH = 3;

  private final InsightsConfig insightsConfig;

  /**
   * Clusters term scores.
   *
   * @param terms candidate terms, any order
   * @return clusters, each sorted by term, ordered by their first term
   */
  List<List<TermScore>> cluster(List<TermScore> terms) {
    if (terms == null || terms.isEmpty()) {
      return List.of();
    }

    InsightsConfig.Extraction config = insightsConfig.getExtraction();
    List<TermScore> sorted = new ArrayList<>(terms);
    sorted.sort(Comparator.comparing(TermScore::term));

    int n = sorted.size();
    int[] leader = new int[n];
    for (int i = 0; i < n; i++) {
      leader[i] = i;
    }
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        if (related(sorted.get(i), sorted.get(j), config)) {
          link(leader, i, j);
        }
      }
    }

    // A cluster's leader is its first member in term order
    SortedMap<Integer, List<TermScore>> byLeader = new TreeMap<>();
    for (int i = 0; i < n; i++) {
      byLeader.computeIfAbsent(leaderOf(leader, i), k -> new ArrayList<>()).add(sorted.get(i));
    }

    List<List<TermScore>> clusters = new ArrayList<>(byLeader.values());
    log.debug("Clustered {} terms into {} topics", n, clusters.size());
    return clusters;
  }

  private boolean related(TermScore a, TermScore b, InsightsConfig.Extraction config) {
    if (a.groupKey() != null && a.groupKey().equals(b.groupKey())) {
      return true;
    }
    if (config.isStemMerging()) {
      String stemA = stem(a.term());
      if (stemA.length() >= MIN_STEM_LENGTH && stemA.equals(stem(b.term()))) {
        return true;
      }
    }
    return a.category() == b.category()
        && a.documentFrequency() >= config.getMinCooccurrenceDocuments()
        && b.documentFrequency() >= config.getMinCooccurrenceDocuments()
        && jaccard(a.documents(), b.documents()) >= config.getCooccurrenceThreshold();
  }

  /** Light suffix stripping applied to the last word of a term. */
  static String stem(String term) {
    int lastSpace = term.lastIndexOf(' ');
    String prefix = lastSpace < 0 ? "" : term.substring(0, lastSpace + 1);
    String word = lastSpace < 0 ? term : term.substring(lastSpace + 1);
    String stemmed;
    if (word.endsWith("ies") && word.length() > 4) {
      stemmed = word.substring(0, word.length() - 3) + "y";
    } else if (word.endsWith("ing") && word.length() > 5) {
      stemmed = word.substring(0, word.length() - 3);
    } else if (word.endsWith("ed") && word.length() > 4) {
      stemmed = word.substring(0, word.length() - 2);
    } else if (word.endsWith("es") && word.length() > 4 && isSibilant(word, word.length() - 2)) {
      stemmed = word.substring(0, word.length() - 2);
    } else if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 3) {
      stemmed = word.substring(0, word.length() - 1);
    } else {
      stemmed = word;
    }
    return prefix + stemmed;
  }

  private static boolean isSibilant(String word, int suffixStart) {
    char before = word.charAt(suffixStart - 1);
    return before == 's' || before == 'x' || before == 'z' || word.startsWith("ch", suffixStart - 2)
        || word.startsWith("sh", suffixStart - 2);
  }

  static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  /** Leader of the cluster holding {@code index}, halving the path on the way up. */
  private static int leaderOf(int[] leader, int index) {
    int current = index;
    while (leader[current] != current) {
      leader[current] = leader[leader[current]];
      current = leader[current];
    }
    return current;
  }

  /** Merges two clusters under the smaller of their leaders. */
  private static void link(int[] leader, int a, int b) {
    int leaderA = leaderOf(leader, a);
    int leaderB = leaderOf(leader, b);
    if (leaderA < leaderB) {
      leader[leaderB] = leaderA;
    } else if (leaderB < leaderA) {
      leader[leaderA] = leaderB;
    }
  }
}
