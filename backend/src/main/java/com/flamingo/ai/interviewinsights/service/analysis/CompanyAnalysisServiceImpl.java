package com.flamingo.ai.interviewinsights.service.analysis;

import com.flamingo.ai.interviewinsights.domain.model.CompanyInsights;
import com.flamingo.ai.interviewinsights.domain.model.DataQualityAssessment;
import com.flamingo.ai.interviewinsights.domain.model.ExperienceRecord;
import com.flamingo.ai.interviewinsights.domain.model.InterviewProcess;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.PreparationStrategy;
import com.flamingo.ai.interviewinsights.domain.model.Recommendation;
import com.flamingo.ai.interviewinsights.domain.model.RunMetadata;
import com.flamingo.ai.interviewinsights.domain.model.SuccessFactors;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TopicDistribution;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import com.flamingo.ai.interviewinsights.exception.MalformedRecordException;
import com.flamingo.ai.interviewinsights.service.insights.DataQualityAssessor;
import com.flamingo.ai.interviewinsights.service.insights.InsightsGenerator;
import com.flamingo.ai.interviewinsights.service.insights.InterviewProcessAnalyzer;
import com.flamingo.ai.interviewinsights.service.insights.PreparationStrategyAdvisor;
import com.flamingo.ai.interviewinsights.service.insights.SuccessFactorAnalyzer;
import com.flamingo.ai.interviewinsights.service.insights.TopicDistributionCalculator;
import com.flamingo.ai.interviewinsights.service.normalize.TextNormalizer;
import com.flamingo.ai.interviewinsights.service.scoring.StatisticalScorer;
import com.flamingo.ai.interviewinsights.service.topic.TopicExtractor;
import com.flamingo.ai.interviewinsights.service.trend.TrendAnalyzer;
import com.flamingo.ai.interviewinsights.service.trend.TrendSeriesBuilder;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates company analysis runs: validation, normalization, topic extraction, scoring, trend
 * analysis, recommendations, data quality, preparation strategy, success factors, topic
 * distribution and interview process.
 *
 * <p>Every run builds its own documents and accumulators; the taxonomy is the only shared state.
 */
@Service
@Slf4j
public class CompanyAnalysisServiceImpl implements CompanyAnalysisService {

  private static final Comparator<ExperienceRecord> RECORD_ID_ORDER =
      Comparator.comparing(
          ExperienceRecord::id, Comparator.nullsLast(Comparator.<String>naturalOrder()));

  private final RecordValidator recordValidator;
  private final TextNormalizer textNormalizer;
  private final TopicExtractor topicExtractor;
  private final StatisticalScorer statisticalScorer;
  private final TrendSeriesBuilder trendSeriesBuilder;
  private final TrendAnalyzer trendAnalyzer;
  private final InsightsGenerator insightsGenerator;
  private final DataQualityAssessor dataQualityAssessor;
  private final PreparationStrategyAdvisor preparationStrategyAdvisor;
  private final SuccessFactorAnalyzer successFactorAnalyzer;
  private final TopicDistributionCalculator topicDistributionCalculator;
  private final InterviewProcessAnalyzer interviewProcessAnalyzer;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Executor companyAnalysisExecutor;

  public CompanyAnalysisServiceImpl(
      RecordValidator recordValidator,
      TextNormalizer textNormalizer,
      TopicExtractor topicExtractor,
      StatisticalScorer statisticalScorer,
      TrendSeriesBuilder trendSeriesBuilder,
      TrendAnalyzer trendAnalyzer,
      InsightsGenerator insightsGenerator,
      DataQualityAssessor dataQualityAssessor,
      PreparationStrategyAdvisor preparationStrategyAdvisor,
      SuccessFactorAnalyzer successFactorAnalyzer,
      TopicDistributionCalculator topicDistributionCalculator,
      InterviewProcessAnalyzer interviewProcessAnalyzer,
      MeterRegistry meterRegistry,
      Clock clock,
      @Qualifier("companyAnalysisExecutor") Executor companyAnalysisExecutor) {
    this.recordValidator = recordValidator;
    this.textNormalizer = textNormalizer;
    this.topicExtractor = topicExtractor;
    this.statisticalScorer = statisticalScorer;
    this.trendSeriesBuilder = trendSeriesBuilder;
    this.trendAnalyzer = trendAnalyzer;
    this.insightsGenerator = insightsGenerator;
    this.dataQualityAssessor = dataQualityAssessor;
    this.preparationStrategyAdvisor = preparationStrategyAdvisor;
    this.successFactorAnalyzer = successFactorAnalyzer;
    this.topicDistributionCalculator = topicDistributionCalculator;
    this.interviewProcessAnalyzer = interviewProcessAnalyzer;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.companyAnalysisExecutor = companyAnalysisExecutor;
  }

  @Override
  public CompanyInsights analyze(String company, Collection<ExperienceRecord> records) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return runAnalysis(company, records);
    } finally {
      sample.stop(meterRegistry.timer("insights.analysis"));
    }
  }

  private CompanyInsights runAnalysis(String company, Collection<ExperienceRecord> records) {
    UUID runId = UUID.randomUUID();
    LocalDate referenceDate = LocalDate.now(clock);
    Collection<ExperienceRecord> input = records == null ? List.of() : records;
    log.debug("Run {} started for {} with {} records", runId, company, input.size());

    Map<String, Integer> skipReasons = new TreeMap<>();
    List<NormalizedDocument> documents = new ArrayList<>();
    for (ExperienceRecord record : input) {
      try {
        recordValidator.validate(record, company);
        documents.add(textNormalizer.normalize(record));
      } catch (MalformedRecordException e) {
        log.debug("Run {} skipped record {}: {}", runId, e.getRecordId(), e.getReason());
        skipReasons.merge(e.getReason(), 1, Integer::sum);
        meterRegistry.counter("insights.records.skipped", "reason", e.getReason()).increment();
      }
    }
    int skipped = skipReasons.values().stream().mapToInt(Integer::intValue).sum();
    if (skipped > 0) {
      log.warn("Run {} for {} skipped {} malformed records: {}", runId, company, skipped, skipReasons);
    }

    List<Topic> topics = new ArrayList<>();
    for (Topic topic : topicExtractor.extractTopics(documents)) {
      topics.add(statisticalScorer.scoreTopic(topic, documents, referenceDate));
    }
    // decay-weighted frequencies can reorder the extracted topics
    topics.sort(TopicExtractor.TOPIC_ORDER);

    List<TrendResult> trends = new ArrayList<>();
    for (Topic topic : topics) {
      trends.add(trendAnalyzer.analyzeTrend(topic, trendSeriesBuilder.build(topic, documents)));
    }

    List<Recommendation> recommendations = insightsGenerator.generateRecommendations(topics, trends);
    DataQualityAssessment dataQuality = dataQualityAssessor.assess(documents, topics);
    PreparationStrategy preparationStrategy = preparationStrategyAdvisor.advise(documents);
    SuccessFactors successFactors = successFactorAnalyzer.analyze(documents, topics);
    TopicDistribution topicDistribution = topicDistributionCalculator.calculate(topics);
    InterviewProcess interviewProcess = interviewProcessAnalyzer.analyze(documents);

    RunMetadata metadata =
        new RunMetadata(
            runId,
            company,
            referenceDate,
            input.size(),
            documents.size(),
            skipped,
            skipReasons);

    meterRegistry.counter("insights.runs.completed").increment();
    log.info(
        "Run {} for {} completed: {} records analyzed, {} topics, {} recommendations, quality {}",
        runId,
        company,
        documents.size(),
        topics.size(),
        recommendations.size(),
        String.format("%.3f", dataQuality.qualityScore()));

    return new CompanyInsights(
        metadata,
        topics,
        trends,
        recommendations,
        dataQuality,
        preparationStrategy,
        successFactors,
        topicDistribution,
        interviewProcess);
  }

  @Override
  @Timed(value = "insights.analysis.all", description = "Time taken to analyze all companies")
  public SortedMap<String, CompanyInsights> analyzeAll(Collection<ExperienceRecord> records) {
    if (records == null || records.isEmpty()) {
      return new TreeMap<>();
    }

    List<ExperienceRecord> sorted = new ArrayList<>();
    int withoutCompany = 0;
    for (ExperienceRecord record : records) {
      if (record == null || record.company() == null || record.company().isBlank()) {
        withoutCompany++;
        meterRegistry
            .counter("insights.records.skipped", "reason", RecordValidator.BLANK_COMPANY)
            .increment();
      } else {
        sorted.add(record);
      }
    }
    if (withoutCompany > 0) {
      log.warn("Skipped {} records without a company", withoutCompany);
    }
    sorted.sort(RECORD_ID_ORDER);

    // company key -> records, display name is the first spelling in record id order
    Map<String, List<ExperienceRecord>> byCompany = new LinkedHashMap<>();
    Map<String, String> displayNames = new LinkedHashMap<>();
    for (ExperienceRecord record : sorted) {
      String key = RecordValidator.companyKey(record.company());
      displayNames.putIfAbsent(key, record.company().trim());
      byCompany.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
    }

    Map<String, CompletableFuture<CompanyInsights>> futures = new LinkedHashMap<>();
    byCompany.forEach(
        (key, companyRecords) -> {
          String company = displayNames.get(key);
          futures.put(
              company,
              CompletableFuture.supplyAsync(
                  () -> analyze(company, companyRecords), companyAnalysisExecutor));
        });

    SortedMap<String, CompanyInsights> results = new TreeMap<>();
    try {
      CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw e;
    }
    futures.forEach((company, future) -> results.put(company, future.join()));
    log.info("Analyzed {} companies from {} records", results.size(), records.size());
    return results;
  }
}
