package com.flamingo.ai.interviewinsights.service.topic;

import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Converts a company's normalized documents into weighted, clustered topics. */
public interface TopicExtractor {

  /** Topic order: weighted frequency desc, composite score desc, representative term asc. */
  Comparator<Topic> TOPIC_ORDER =
      Comparator.comparingDouble(Topic::weightedFrequency)
          .reversed()
          .thenComparing(Comparator.comparingDouble(Topic::compositeScore).reversed())
          .thenComparing(Topic::representativeTerm);

  /**
   * Extracts topics from one company's documents.
   *
   * <p>The result depends only on the multiset of documents, never on their order. The statistical
   * fields of the returned topics are not populated yet.
   *
   * @param documents normalized documents of one company
   * @return topics ordered by weighted frequency, composite score and term; empty for no documents
   */
  List<Topic> extractTopics(Collection<NormalizedDocument> documents);

  /**
   * Counts occurrences of a topic's member terms in a document. A document references the topic
   * when the count is positive.
   *
   * @param topic the topic
   * @param document the document
   * @return number of member-term occurrences in the document
   */
  static int occurrences(Topic topic, NormalizedDocument document) {
    int count = 0;
    for (String token : document.tokens()) {
      if (topic.memberTerms().contains(token)) {
        count++;
      }
    }
    return count;
  }
}
