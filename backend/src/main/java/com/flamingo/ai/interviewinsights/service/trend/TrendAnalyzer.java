package com.flamingo.ai.interviewinsights.service.trend;

import com.flamingo.ai.interviewinsights.domain.model.TimeBucket;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TrendResult;
import java.util.List;

/** Detects significant shifts of a topic's importance over time. */
public interface TrendAnalyzer {

  /**
   * Tests a topic's historical series for a monotonic trend.
   *
   * @param topic the topic the series belongs to
   * @param historicalSeries buckets in chronological order
   * @return the trend result; STABLE and not significant when the series is too short
   */
  TrendResult analyzeTrend(Topic topic, List<TimeBucket> historicalSeries);
}
