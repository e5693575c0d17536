package com.flamingo.ai.interviewinsights.service.topic;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.taxonomy.TaxonomyTerm;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Topic extraction based on damped tf-idf, taxonomy category weights and term clustering.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Count candidate terms per document in fixed-size batches and merge the batch counts
 *   <li>Score each term: sum over documents of (1 + ln tf) * ln(N / df) * category weight
 *   <li>Cluster related terms (see {@link TermClusterer})
 *   <li>weightedFrequency = document coverage in percent * category weight / largest taxonomy
 *       weight, rounded half-up to two decimals. The scorer later replaces the plain coverage with
 *       the decay-weighted one.
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicExtractorImpl implements TopicExtractor {

  private static final Pattern NUMERIC = Pattern.compile("[\\d\\s]+");

  // Most documents first, then higher importance, canonical terms, alphabetical
  private static final Comparator<TermScore> REPRESENTATIVE_ORDER =
      Comparator.comparingInt(TermScore::documentFrequency)
          .reversed()
          .thenComparing(Comparator.comparingDouble(TermScore::importance).reversed())
          .thenComparing(TermScore::canonical, Comparator.reverseOrder())
          .thenComparing(TermScore::term);

  private final DomainTaxonomy taxonomy;
  private final TermClusterer termClusterer;
  private final InsightsConfig insightsConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public List<Topic> extractTopics(Collection<NormalizedDocument> documents) {
    if (documents == null || documents.isEmpty()) {
      return List.of();
    }

    InsightsConfig.Extraction config = insightsConfig.getExtraction();
    List<NormalizedDocument> valid = NormalizedDocument.canonicalOrder(documents);
    TermStatistics statistics = collect(valid, config);
    int totalDocuments = statistics.totalDocuments();
    if (totalDocuments == 0) {
      return List.of();
    }

    List<TermScore> scores = new ArrayList<>();
    for (String term : new TreeSet<>(statistics.terms())) {
      scoreTerm(term, statistics, totalDocuments, config).ifPresent(scores::add);
    }

    String company =
        valid.stream()
            .map(NormalizedDocument::companyRef)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(null);

    List<Topic> topics = new ArrayList<>();
    for (List<TermScore> cluster : termClusterer.cluster(scores)) {
      topics.add(toTopic(cluster, company, totalDocuments));
    }
    topics.sort(TOPIC_ORDER);
    List<Topic> result =
        topics.size() > config.getMaxTopics()
            ? List.copyOf(topics.subList(0, config.getMaxTopics()))
            : List.copyOf(topics);

    meterRegistry.counter("insights.topics.extracted").increment(result.size());
    log.debug(
        "Extracted {} topics from {} documents ({} candidate terms) for {}",
        result.size(),
        totalDocuments,
        scores.size(),
        company);
    return result;
  }

  private TermStatistics collect(List<NormalizedDocument> documents, InsightsConfig.Extraction config) {
    int batchSize = config.getBatchSize();
    TermStatistics statistics = TermStatistics.empty();
    for (int start = 0; start < documents.size(); start += batchSize) {
      List<NormalizedDocument> batch =
          documents.subList(start, Math.min(documents.size(), start + batchSize));
      statistics = statistics.merge(TermStatistics.collect(batch, this::isCandidate));
    }
    return statistics;
  }

  private boolean isCandidate(String token) {
    if (token == null || token.isBlank()) {
      return false;
    }
    if (taxonomy.contains(token)) {
      return true;
    }
    return insightsConfig.getExtraction().isIncludeUncategorizedTerms()
        && token.length() <= insightsConfig.getNormalization().getMaxTokenLength()
        && !NUMERIC.matcher(token).matches();
  }

  private Optional<TermScore> scoreTerm(
      String term, TermStatistics statistics, int totalDocuments, InsightsConfig.Extraction config) {
    int documentFrequency = statistics.documentFrequency(term);
    Optional<TaxonomyTerm> taxonomyTerm = taxonomy.lookup(term);
    if (taxonomyTerm.isEmpty() && documentFrequency < config.getMinDocumentFrequency()) {
      return Optional.empty();
    }

    TopicCategory category = taxonomyTerm.map(TaxonomyTerm::category).orElse(TopicCategory.OTHER);
    double weight = taxonomyTerm.map(TaxonomyTerm::weight).orElse(taxonomy.weightOf(category));
    double idf = Math.log((double) totalDocuments / documentFrequency);

    SortedMap<String, Integer> counts = statistics.countsFor(term);
    double importance = 0.0;
    for (int count : counts.values()) {
      importance += ScoreMath.dampen(count) * idf * weight;
    }

    return Optional.of(
        new TermScore(
            term,
            category,
            weight,
            taxonomyTerm.map(TaxonomyTerm::groupKey).orElse(null),
            taxonomyTerm.map(TaxonomyTerm::isCanonical).orElse(false),
            new TreeSet<>(counts.keySet()),
            importance));
  }

  private Topic toTopic(List<TermScore> cluster, String company, int totalDocuments) {
    TermScore representative = cluster.stream().min(REPRESENTATIVE_ORDER).orElseThrow();

    TreeSet<String> members = new TreeSet<>();
    TreeSet<String> coveredDocuments = new TreeSet<>();
    double composite = 0.0;
    for (TermScore term : cluster) {
      members.add(term.term());
      coveredDocuments.addAll(term.documents());
      composite += term.importance();
    }

    double coverage = coveredDocuments.size() * 100.0 / totalDocuments;
    double weightedFrequency =
        ScoreMath.weightedFrequency(coverage, representative.weight(), taxonomy.maxWeight());
    InsightsConfig.Priority priority = insightsConfig.getPriority();

    return Topic.builder()
        .id(topicId(representative.term()))
        .companyRef(company)
        .representativeTerm(representative.term())
        .memberTerms(members)
        .category(representative.category())
        .weightedFrequency(weightedFrequency)
        .compositeScore(ScoreMath.round(composite, 6))
        .documentCount(coveredDocuments.size())
        .priorityLevel(
            PriorityLevel.classify(
                weightedFrequency,
                0.0,
                priority.getHighThreshold(),
                priority.getMediumThreshold(),
                priority.getMinHighConfidence()))
        .successCorrelation(0.5)
        .build();
  }

  static String topicId(String representativeTerm) {
    return representativeTerm.replaceAll("[^\\p{L}\\p{N}+#]+", "-");
  }
}
