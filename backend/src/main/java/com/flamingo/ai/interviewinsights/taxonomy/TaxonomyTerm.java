package com.flamingo.ai.interviewinsights.taxonomy;

import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import java.util.Set;

/**
 * A term of the domain taxonomy resolved to its primary placement.
 *
 * @param term canonical term text
 * @param category category of the primary placement
 * @param groupKey {@code category.group} key of the primary topic group
 * @param canonicalTerm first term of the primary topic group
 * @param weight maximum multiplier over every category listing the term
 * @param categories every category listing the term
 */
public record TaxonomyTerm(
    String term,
    TopicCategory category,
    String groupKey,
    String canonicalTerm,
    double weight,
    Set<TopicCategory> categories) {

  public TaxonomyTerm {
    categories = Set.copyOf(categories);
  }

  public boolean isCanonical() {
    return term.equals(canonicalTerm);
  }
}
