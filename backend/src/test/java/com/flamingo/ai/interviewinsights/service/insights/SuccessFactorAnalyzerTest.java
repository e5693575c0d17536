package com.flamingo.ai.interviewinsights.service.insights;

import static com.flamingo.ai.interviewinsights.TestFixtures.REFERENCE_DATE;
import static com.flamingo.ai.interviewinsights.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import com.flamingo.ai.interviewinsights.domain.enums.QualityLevel;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.OutcomePattern;
import com.flamingo.ai.interviewinsights.domain.model.SuccessFactors;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SuccessFactorAnalyzer Tests")
class SuccessFactorAnalyzerTest {

  private final SuccessFactorAnalyzer analyzer = new SuccessFactorAnalyzer();

  private static Topic topic(String term, String... members) {
    TreeSet<String> memberTerms = new TreeSet<>(List.of(members));
    memberTerms.add(term);
    return Topic.builder().id(term).representativeTerm(term).memberTerms(memberTerms).build();
  }

  private static NormalizedDocument outcomeDocument(String id, Outcome outcome, String... tokens) {
    return document(id, REFERENCE_DATE, outcome, tokens);
  }

  @Test
  @DisplayName("Should split topics into success and failure patterns by mention rate")
  void shouldFindSuccessAndFailurePatterns() {
    List<NormalizedDocument> documents =
        List.of(
            outcomeDocument("s1", Outcome.SUCCESS, "caching", "redis"),
            outcomeDocument("s2", Outcome.SUCCESS, "cache"),
            outcomeDocument("f1", Outcome.FAIL, "trie"),
            outcomeDocument("f2", Outcome.FAIL, "trie", "caching"),
            outcomeDocument("u1", Outcome.UNKNOWN, "trie"));
    List<Topic> topics = List.of(topic("caching", "cache", "redis"), topic("trie"));

    SuccessFactors factors = analyzer.analyze(documents, topics);

    assertThat(factors.successfulCount()).isEqualTo(2);
    assertThat(factors.unsuccessfulCount()).isEqualTo(2);
    assertThat(factors.unknownCount()).isEqualTo(1);
    assertThat(factors.successPatterns())
        .containsExactly(new OutcomePattern("caching", "caching", 100.0, 50.0));
    assertThat(factors.failurePatterns())
        .containsExactly(new OutcomePattern("trie", "trie", 100.0, 100.0));
    assertThat(factors.confidence()).isEqualTo(QualityLevel.MEDIUM);
  }

  @Test
  @DisplayName("Should ignore small rate differences")
  void shouldIgnoreSmallDifferences() {
    List<NormalizedDocument> documents =
        List.of(
            outcomeDocument("s1", Outcome.SUCCESS, "trie"),
            outcomeDocument("s2", Outcome.SUCCESS, "java"),
            outcomeDocument("f1", Outcome.FAIL, "trie"),
            outcomeDocument("f2", Outcome.FAIL, "kafka"));

    SuccessFactors factors = analyzer.analyze(documents, List.of(topic("trie")));

    assertThat(factors.successPatterns()).isEmpty();
    assertThat(factors.failurePatterns()).isEmpty();
    assertThat(factors.confidence()).isEqualTo(QualityLevel.LOW);
  }

  @Test
  @DisplayName("Should only report sample sizes when an outcome has too few reports")
  void shouldSkipPatternsForSmallOutcomeSamples() {
    List<NormalizedDocument> documents =
        List.of(
            outcomeDocument("s1", Outcome.SUCCESS, "caching"),
            outcomeDocument("s2", Outcome.SUCCESS, "caching"),
            outcomeDocument("f1", Outcome.FAIL, "trie"));

    SuccessFactors factors =
        analyzer.analyze(documents, List.of(topic("caching"), topic("trie")));

    assertThat(factors.successfulCount()).isEqualTo(2);
    assertThat(factors.unsuccessfulCount()).isEqualTo(1);
    assertThat(factors.successPatterns()).isEmpty();
    assertThat(factors.failurePatterns()).isEmpty();
    assertThat(factors.confidence()).isEqualTo(QualityLevel.LOW);
  }
}
