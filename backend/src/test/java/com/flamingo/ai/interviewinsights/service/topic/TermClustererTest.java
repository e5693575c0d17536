package com.flamingo.ai.interviewinsights.service.topic;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.interviewinsights.TestFixtures;
import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TermClusterer Tests")
class TermClustererTest {

  private InsightsConfig config;
  private TermClusterer clusterer;

  @BeforeEach
  void setUp() {
    config = TestFixtures.config();
    clusterer = new TermClusterer(config);
  }

  private static TermScore term(
      String term, TopicCategory category, String groupKey, String... documents) {
    return new TermScore(
        term, category, 1.0, groupKey, false, new TreeSet<>(List.of(documents)), 1.0);
  }

  private static List<List<String>> names(List<List<TermScore>> clusters) {
    return clusters.stream().map(c -> c.stream().map(TermScore::term).toList()).toList();
  }

  @Test
  @DisplayName("Should return no clusters for empty input")
  void shouldReturnNoClustersForEmptyInput() {
    assertThat(clusterer.cluster(List.of())).isEmpty();
    assertThat(clusterer.cluster(null)).isEmpty();
  }

  @Test
  @DisplayName("Should merge terms of the same taxonomy group")
  void shouldMergeSameGroup() {
    List<List<TermScore>> clusters =
        clusterer.cluster(
            List.of(
                term("hashmap", TopicCategory.DATA_STRUCTURES, "data_structures.hash_table", "d1"),
                term("hash set", TopicCategory.DATA_STRUCTURES, "data_structures.hash_table", "d2"),
                term("trie", TopicCategory.DATA_STRUCTURES, "data_structures.trie", "d3")));

    assertThat(names(clusters)).containsExactly(List.of("hash set", "hashmap"), List.of("trie"));
  }

  @Test
  @DisplayName("Should merge terms sharing a stem only when stem merging is enabled")
  void shouldMergeSharedStems() {
    List<TermScore> terms =
        List.of(
            term("interview", TopicCategory.OTHER, null, "d1"),
            term("interviews", TopicCategory.OTHER, null, "d2"));

    assertThat(names(clusterer.cluster(terms))).containsExactly(List.of("interview", "interviews"));

    config.getExtraction().setStemMerging(false);
    assertThat(clusterer.cluster(terms)).hasSize(2);
  }

  @Test
  @DisplayName("Should merge co-occurring terms of the same category")
  void shouldMergeCooccurringTerms() {
    List<List<TermScore>> clusters =
        clusterer.cluster(
            List.of(
                term("kafka", TopicCategory.SYSTEM_DESIGN, "system_design.messaging", "d1", "d2", "d3"),
                term("redis", TopicCategory.SYSTEM_DESIGN, "system_design.caching", "d1", "d2", "d3"),
                term("python", TopicCategory.TECHNOLOGIES, "technologies.languages", "d1", "d2", "d3")));

    assertThat(names(clusters)).containsExactly(List.of("kafka", "redis"), List.of("python"));
  }

  @Test
  @DisplayName("Should not merge co-occurring terms below the minimum document count")
  void shouldNotMergeRareCooccurringTerms() {
    List<List<TermScore>> clusters =
        clusterer.cluster(
            List.of(
                term("kafka", TopicCategory.SYSTEM_DESIGN, "system_design.messaging", "d1", "d2"),
                term("redis", TopicCategory.SYSTEM_DESIGN, "system_design.caching", "d1", "d2")));

    assertThat(clusters).hasSize(2);
  }

  @Test
  @DisplayName("Should merge transitively")
  void shouldMergeTransitively() {
    List<List<TermScore>> clusters =
        clusterer.cluster(
            List.of(
                term("graphs", TopicCategory.DATA_STRUCTURES, "data_structures.graph", "d1"),
                term("graph", TopicCategory.OTHER, null, "d2"),
                term("vertices", TopicCategory.DATA_STRUCTURES, "data_structures.graph", "d3")));

    assertThat(clusters).hasSize(1);
    assertThat(clusters.get(0)).extracting(TermScore::term)
        .containsExactly("graph", "graphs", "vertices");
  }

  @Test
  @DisplayName("Should order interleaved clusters by their first term")
  void shouldOrderInterleavedClustersByFirstTerm() {
    List<List<TermScore>> clusters =
        clusterer.cluster(
            List.of(
                term("fig", TopicCategory.OTHER, "g3", "d6"),
                term("elder", TopicCategory.OTHER, "g1", "d5"),
                term("date", TopicCategory.OTHER, "g2", "d4"),
                term("cherry", TopicCategory.OTHER, "g3", "d3"),
                term("banana", TopicCategory.OTHER, "g2", "d2"),
                term("apple", TopicCategory.OTHER, "g1", "d1")));

    assertThat(names(clusters))
        .containsExactly(
            List.of("apple", "elder"), List.of("banana", "date"), List.of("cherry", "fig"));
  }

  @ParameterizedTest
  @CsvSource({
    "binaries, binary",
    "graphs, graph",
    "classes, class",
    "hashing, hash",
    "merge sorts, merge sort",
    "class, class",
    "bus, bus",
    "ring, ring"
  })
  @DisplayName("Should strip light suffixes from the last word")
  void shouldStripLightSuffixes(String term, String expected) {
    assertThat(TermClusterer.stem(term)).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should compute Jaccard similarity of document sets")
  void shouldComputeJaccard() {
    assertThat(TermClusterer.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isEqualTo(1.0 / 3.0);
    assertThat(TermClusterer.jaccard(Set.of(), Set.of())).isZero();
  }
}
