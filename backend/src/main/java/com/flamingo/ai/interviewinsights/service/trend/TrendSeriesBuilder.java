package com.flamingo.ai.interviewinsights.service.trend;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.TimeBucket;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.service.topic.TopicExtractor;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a topic's historical series from a company corpus.
 *
 * <p>Windows span {@code insights.trend.bucket-months} months and are aligned to month index
 * multiples, which for three months are calendar quarters. Windows without documents are left out
 * and undated documents are ignored.
 */
@Component
@RequiredArgsConstructor
public class TrendSeriesBuilder {

  private final InsightsConfig insightsConfig;

  public List<TimeBucket> build(Topic topic, Collection<NormalizedDocument> documents) {
    int bucketMonths = insightsConfig.getTrend().getBucketMonths();
    // window index -> [documents, referencing documents]
    Map<Long, int[]> windows = new TreeMap<>();
    for (NormalizedDocument document : NormalizedDocument.canonicalOrder(documents)) {
      if (document.date() == null) {
        continue;
      }
      long monthIndex = document.date().getYear() * 12L + document.date().getMonthValue() - 1;
      int[] counts = windows.computeIfAbsent(Math.floorDiv(monthIndex, bucketMonths), k -> new int[2]);
      counts[0]++;
      if (TopicExtractor.occurrences(topic, document) > 0) {
        counts[1]++;
      }
    }

    List<TimeBucket> series = new ArrayList<>(windows.size());
    windows.forEach(
        (window, counts) -> {
          LocalDate start = monthStart(window * bucketMonths);
          series.add(
              new TimeBucket(
                  start, start.plusMonths(bucketMonths), counts[0], (double) counts[1] / counts[0]));
        });
    return List.copyOf(series);
  }

  private static LocalDate monthStart(long monthIndex) {
    return LocalDate.of((int) Math.floorDiv(monthIndex, 12L), (int) Math.floorMod(monthIndex, 12L) + 1, 1);
  }
}
