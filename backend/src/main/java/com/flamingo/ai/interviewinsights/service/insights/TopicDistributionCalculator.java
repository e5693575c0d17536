package com.flamingo.ai.interviewinsights.service.insights;

import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TopicDistribution;
import com.flamingo.ai.interviewinsights.util.ScoreMath;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/** Counts a run's topics per category and per priority level. */
@Component
public class TopicDistributionCalculator {

  public TopicDistribution calculate(List<Topic> topics) {
    List<Topic> all = topics == null ? List.of() : topics;
    return new TopicDistribution(
        all.size(), shares(all, Topic::category), shares(all, Topic::priorityLevel));
  }

  private static <K extends Comparable<K>> Map<K, TopicDistribution.Share> shares(
      List<Topic> topics, Function<Topic, K> classifier) {
    Map<K, Integer> counts = new TreeMap<>();
    for (Topic topic : topics) {
      counts.merge(classifier.apply(topic), 1, Integer::sum);
    }
    Map<K, TopicDistribution.Share> shares = new TreeMap<>();
    counts.forEach(
        (key, count) ->
            shares.put(
                key,
                new TopicDistribution.Share(
                    count, ScoreMath.round(count * 100.0 / topics.size(), 1))));
    return shares;
  }
}
