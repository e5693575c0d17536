package com.flamingo.ai.interviewinsights.service.topic;

import static com.flamingo.ai.interviewinsights.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.interviewinsights.TestFixtures;
import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TopicExtractorImpl Tests")
class TopicExtractorImplTest {

  private InsightsConfig config;
  private SimpleMeterRegistry meterRegistry;
  private TopicExtractorImpl extractor;

  @BeforeEach
  void setUp() {
    config = TestFixtures.config();
    meterRegistry = new SimpleMeterRegistry();
    extractor =
        new TopicExtractorImpl(
            TestFixtures.taxonomy(), new TermClusterer(config), config, meterRegistry);
  }

  private static List<NormalizedDocument> corpus() {
    return List.of(
        document("d1", "system design", "hard", "hashmap", "redis"),
        document("d2", "system design", "scalability", "round", "2"),
        document("d3", "system design", "binary search", "hashmap", "hashmap"),
        document("d4", "system design", "dynamic programming", "leetcode"),
        document("d5", "behavioral", "leadership", "leetcode", "2024"));
  }

  @Test
  @DisplayName("Should give a topic of the heaviest category its plain coverage")
  void shouldWeighHeaviestCategoryByCoverage() {
    List<Topic> topics = extractor.extractTopics(corpus());

    Topic systemDesign = topics.get(0);
    assertThat(systemDesign.representativeTerm()).isEqualTo("system design");
    assertThat(systemDesign.id()).isEqualTo("system-design");
    assertThat(systemDesign.category()).isEqualTo(TopicCategory.SYSTEM_DESIGN);
    assertThat(systemDesign.documentCount()).isEqualTo(4);
    assertThat(systemDesign.weightedFrequency()).isEqualTo(80.00);
    assertThat(systemDesign.companyRef()).isEqualTo(TestFixtures.COMPANY);
  }

  @Test
  @DisplayName("Should scale coverage by the category weight relative to the heaviest category")
  void shouldScaleCoverageByCategoryWeight() {
    List<NormalizedDocument> documents =
        List.of(
            document("d1", "system design"),
            document("d2", "system design"),
            document("d3", "java"),
            document("d4", "java"),
            document("d5", "java"));

    List<Topic> topics = extractor.extractTopics(documents);

    assertThat(topics)
        .filteredOn(t -> t.representativeTerm().equals("system design"))
        .singleElement()
        .satisfies(t -> assertThat(t.weightedFrequency()).isEqualTo(40.00));
    assertThat(topics)
        .filteredOn(t -> t.representativeTerm().equals("java"))
        .singleElement()
        .satisfies(t -> assertThat(t.weightedFrequency()).isEqualTo(41.25));
  }

  @Test
  @DisplayName("Should keep common topics apart instead of saturating at 100")
  void shouldNotSaturateWeightedFrequency() {
    List<NormalizedDocument> documents =
        List.of(
            document("d1", "caching", "sharding"),
            document("d2", "caching", "sharding"),
            document("d3", "caching", "sharding"),
            document("d4", "caching"),
            document("d5", "caching"));

    List<Topic> topics = extractor.extractTopics(documents);

    assertThat(topics).extracting(Topic::representativeTerm).containsExactly("caching", "sharding");
    assertThat(topics).extracting(Topic::weightedFrequency).containsExactly(100.00, 60.00);
  }

  @Test
  @DisplayName("Should count every copy of equal documents without an id")
  void shouldCountAnonymousDuplicates() {
    List<NormalizedDocument> documents =
        List.of(
            document(null, "system design"),
            document(null, "system design"),
            document(null, "behavioral"),
            document(null, "system design"),
            document(null, "system design"));

    List<Topic> topics = extractor.extractTopics(documents);

    assertThat(topics)
        .filteredOn(t -> t.representativeTerm().equals("system design"))
        .singleElement()
        .satisfies(
            t -> {
              assertThat(t.documentCount()).isEqualTo(4);
              assertThat(t.weightedFrequency()).isEqualTo(80.00);
            });
    assertThat(topics)
        .filteredOn(t -> t.representativeTerm().equals("behavioral"))
        .singleElement()
        .satisfies(
            t -> {
              assertThat(t.documentCount()).isEqualTo(1);
              assertThat(t.weightedFrequency()).isEqualTo(12.50);
            });
  }

  @Test
  @DisplayName("Should merge taxonomy group members into one topic")
  void shouldMergeGroupMembers() {
    List<NormalizedDocument> documents =
        List.of(document("d1", "hashmap"), document("d2", "hash table"), document("d3", "java"));

    List<Topic> topics = extractor.extractTopics(documents);

    assertThat(topics)
        .filteredOn(t -> t.memberTerms().contains("hashmap"))
        .singleElement()
        .satisfies(
            t -> {
              assertThat(t.memberTerms()).containsExactly("hash table", "hashmap");
              assertThat(t.representativeTerm()).isEqualTo("hashmap");
              assertThat(t.documentCount()).isEqualTo(2);
            });
  }

  @Test
  @DisplayName("Should pick the member referenced by most documents as representative")
  void shouldPickMostFrequentMemberAsRepresentative() {
    List<NormalizedDocument> documents =
        List.of(
            document("d1", "hld"),
            document("d2", "hld"),
            document("d3", "hld", "system design"),
            document("d4", "java"));

    Topic topic = extractor.extractTopics(documents).get(0);

    assertThat(topic.representativeTerm()).isEqualTo("hld");
    assertThat(topic.memberTerms()).containsExactly("hld", "system design");
    assertThat(topic.documentCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should order topics by weighted frequency then composite score")
  void shouldOrderTopics() {
    List<Topic> topics = extractor.extractTopics(corpus());

    for (int i = 1; i < topics.size(); i++) {
      Topic previous = topics.get(i - 1);
      Topic current = topics.get(i);
      assertThat(previous.weightedFrequency()).isGreaterThanOrEqualTo(current.weightedFrequency());
    }
    assertThat(topics)
        .allSatisfy(
            t -> {
              assertThat(t.weightedFrequency()).isBetween(0.0, 100.0);
              assertThat(t.compositeScore()).isGreaterThanOrEqualTo(0.0);
            });
  }

  @Test
  @DisplayName("Should produce identical topics for any input order and batch size")
  void shouldBeIndependentOfInputOrder() {
    List<Topic> expected = extractor.extractTopics(corpus());

    config.getExtraction().setBatchSize(2);
    Random random = new Random(42);
    for (int i = 0; i < 10; i++) {
      List<NormalizedDocument> shuffled = new ArrayList<>(corpus());
      Collections.shuffle(shuffled, random);
      assertThat(extractor.extractTopics(shuffled)).isEqualTo(expected);
    }
  }

  @Test
  @DisplayName("Should ignore uncategorized terms unless enabled")
  void shouldHandleUncategorizedTerms() {
    assertThat(extractor.extractTopics(corpus()))
        .noneMatch(t -> t.category() == TopicCategory.OTHER);

    config.getExtraction().setIncludeUncategorizedTerms(true);
    List<Topic> topics = extractor.extractTopics(corpus());

    assertThat(topics)
        .filteredOn(t -> t.category() == TopicCategory.OTHER)
        .extracting(Topic::representativeTerm)
        .containsExactly("leetcode");
  }

  @Test
  @DisplayName("Should limit the number of topics")
  void shouldLimitTopics() {
    config.getExtraction().setMaxTopics(2);

    assertThat(extractor.extractTopics(corpus())).hasSize(2);
  }

  @Test
  @DisplayName("Should leave statistics unscored with a provisional priority")
  void shouldLeaveStatisticsUnscored() {
    Topic topic = extractor.extractTopics(corpus()).get(0);

    assertThat(topic.confidenceScore()).isZero();
    assertThat(topic.sampleSize()).isZero();
    assertThat(topic.successCorrelation()).isEqualTo(0.5);
    assertThat(topic.priorityLevel()).isEqualTo(PriorityLevel.MEDIUM);
  }

  @Test
  @DisplayName("Should return empty list and count extracted topics")
  void shouldHandleEmptyInputAndCountTopics() {
    assertThat(extractor.extractTopics(List.of())).isEmpty();
    assertThat(extractor.extractTopics(null)).isEmpty();

    int extracted = extractor.extractTopics(corpus()).size();
    assertThat(meterRegistry.counter("insights.topics.extracted").count()).isEqualTo(extracted);
  }

  @Test
  @DisplayName("Should count member occurrences in a document")
  void shouldCountOccurrences() {
    Topic topic =
        extractor.extractTopics(corpus()).stream()
            .filter(t -> t.memberTerms().contains("hashmap"))
            .findFirst()
            .orElseThrow();

    assertThat(TopicExtractor.occurrences(topic, document("x", "hashmap", "hashmap", "trie")))
        .isEqualTo(2);
    assertThat(TopicExtractor.occurrences(topic, document("y", "trie"))).isZero();
  }
}
