package com.flamingo.ai.interviewinsights.taxonomy;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of the taxonomy YAML file, before validation.
 *
 * @param categories category key to category definition
 */
public record TaxonomyDefinition(Map<String, CategoryDefinition> categories) {

  /**
   * One category of the taxonomy.
   *
   * @param weight importance multiplier of the category's terms
   * @param topics topic group key to member terms; the first term is the canonical one
   */
  public record CategoryDefinition(Double weight, Map<String, List<String>> topics) {}
}
