package com.flamingo.ai.interviewinsights.taxonomy;

import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.exception.TaxonomyConfigurationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable lookup from taxonomy terms to their category, topic group and weight.
 *
 * <p>Built once at startup and shared read-only by every analysis run, so no synchronization is
 * needed.
 */
@Slf4j
public final class DomainTaxonomy {

  private final Map<String, TaxonomyTerm> terms;
  private final Map<TopicCategory, Double> categoryWeights;
  private final int maxPhraseWords;
  private final double maxWeight;

  private DomainTaxonomy(
      Map<String, TaxonomyTerm> terms, Map<TopicCategory, Double> categoryWeights) {
    this.terms = Map.copyOf(terms);
    this.categoryWeights = Map.copyOf(categoryWeights);
    this.maxPhraseWords =
        terms.keySet().stream().mapToInt(t -> t.split(" ").length).max().orElse(1);
    this.maxWeight =
        categoryWeights.values().stream()
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(TopicCategory.OTHER_WEIGHT);
  }

  /**
   * Validates a raw definition and builds the lookup.
   *
   * @param definition the parsed taxonomy file
   * @param location where the definition came from, for error messages
   * @return the taxonomy
   * @throws TaxonomyConfigurationException when the definition is empty or invalid
   */
  public static DomainTaxonomy from(TaxonomyDefinition definition, String location) {
    if (definition == null
        || definition.categories() == null
        || definition.categories().isEmpty()) {
      throw new TaxonomyConfigurationException(location, "Taxonomy defines no categories");
    }

    Map<TopicCategory, Double> weights = new EnumMap<>(TopicCategory.class);
    weights.put(TopicCategory.OTHER, TopicCategory.OTHER_WEIGHT);
    List<Placement> placements = new ArrayList<>();

    for (Map.Entry<String, TaxonomyDefinition.CategoryDefinition> entry :
        definition.categories().entrySet()) {
      String key = entry.getKey();
      TaxonomyDefinition.CategoryDefinition category = entry.getValue();
      if (category == null) {
        throw new TaxonomyConfigurationException(location, "Category '" + key + "' is empty");
      }
      TopicCategory resolved = TopicCategory.fromKey(key);
      double weight = resolveWeight(key, resolved, category.weight(), location);
      weights.merge(resolved, weight, Math::max);

      if (category.topics() == null || category.topics().isEmpty()) {
        throw new TaxonomyConfigurationException(
            location, "Category '" + key + "' defines no topics");
      }
      for (Map.Entry<String, List<String>> group : category.topics().entrySet()) {
        List<String> members = group.getValue();
        if (members == null || members.isEmpty()) {
          throw new TaxonomyConfigurationException(
              location, "Topic group '" + key + "." + group.getKey() + "' has no terms");
        }
        String groupKey = resolved.getKey() + "." + group.getKey();
        String canonical = null;
        for (String member : members) {
          String term = TermText.canonical(member);
          if (term.isEmpty()) {
            throw new TaxonomyConfigurationException(
                location, "Topic group '" + groupKey + "' contains a blank term");
          }
          if (canonical == null) {
            canonical = term;
          }
          placements.add(new Placement(term, resolved, groupKey, canonical, weight));
        }
      }
    }

    Map<String, TaxonomyTerm> terms = new HashMap<>();
    Map<String, List<Placement>> byTerm = new HashMap<>();
    for (Placement placement : placements) {
      byTerm.computeIfAbsent(placement.term(), k -> new ArrayList<>()).add(placement);
    }
    for (Map.Entry<String, List<Placement>> entry : byTerm.entrySet()) {
      List<Placement> candidates = entry.getValue();
      Placement primary = candidates.stream().min(Placement.PRIMARY_ORDER).orElseThrow();
      Set<TopicCategory> categories = EnumSet.noneOf(TopicCategory.class);
      candidates.forEach(p -> categories.add(p.category()));
      terms.put(
          entry.getKey(),
          new TaxonomyTerm(
              entry.getKey(),
              primary.category(),
              primary.groupKey(),
              primary.canonical(),
              primary.weight(),
              categories));
    }

    log.info(
        "Loaded taxonomy from {}: {} categories, {} terms", location, weights.size() - 1, terms.size());
    return new DomainTaxonomy(terms, weights);
  }

  private static double resolveWeight(
      String key, TopicCategory resolved, Double weight, String location) {
    if (resolved == TopicCategory.OTHER) {
      if (!"other".equals(key)) {
        log.warn("Unknown taxonomy category '{}' in {}, mapping to OTHER", key, location);
      }
      return TopicCategory.OTHER_WEIGHT;
    }
    if (weight == null || weight.isNaN() || weight.isInfinite() || weight <= 0.0) {
      throw new TaxonomyConfigurationException(
          location, "Category '" + key + "' must have a positive weight, got " + weight);
    }
    return weight;
  }

  /** Looks up a canonical term. */
  public Optional<TaxonomyTerm> lookup(String term) {
    return Optional.ofNullable(term == null ? null : terms.get(term));
  }

  public boolean contains(String term) {
    return term != null && terms.containsKey(term);
  }

  /** All canonical terms. */
  public Set<String> terms() {
    return terms.keySet();
  }

  /**
   * Multiplier of a category; {@link TopicCategory#OTHER} and categories missing from the file
   * weigh 1.0.
   */
  public double weightOf(TopicCategory category) {
    return categoryWeights.getOrDefault(category, TopicCategory.OTHER_WEIGHT);
  }

  /** Largest category multiplier; weighted frequencies are scaled by weight / maxWeight. */
  public double maxWeight() {
    return maxWeight;
  }

  /** Word count of the longest taxonomy phrase. */
  public int maxPhraseWords() {
    return maxPhraseWords;
  }

  public int size() {
    return terms.size();
  }

  private record Placement(
      String term, TopicCategory category, String groupKey, String canonical, double weight) {

    // Highest weight first, then category declaration order, then group key
    static final Comparator<Placement> PRIMARY_ORDER =
        Comparator.comparingDouble(Placement::weight)
            .reversed()
            .thenComparing(Placement::category)
            .thenComparing(Placement::groupKey);
  }
}
