package com.flamingo.ai.interviewinsights.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.exception.TaxonomyConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("TaxonomyLoader Tests")
class TaxonomyLoaderTest {

  private TaxonomyLoader loader;

  @BeforeEach
  void setUp() {
    loader = new TaxonomyLoader(new DefaultResourceLoader());
  }

  @Test
  @DisplayName("Should load the bundled taxonomy")
  void shouldLoadBundledTaxonomy() {
    DomainTaxonomy taxonomy = loader.load("classpath:taxonomy.yml");

    assertThat(taxonomy.size()).isGreaterThan(100);
    assertThat(taxonomy.contains("system design")).isTrue();
    assertThat(taxonomy.contains("c++")).isTrue();
  }

  @Test
  @DisplayName("Should fail with the location when the resource is missing")
  void shouldFailWhenResourceMissing() {
    assertThatThrownBy(() -> loader.load("classpath:taxonomy/does-not-exist.yml"))
        .isInstanceOf(TaxonomyConfigurationException.class)
        .satisfies(
            e ->
                assertThat(((TaxonomyConfigurationException) e).getLocation())
                    .isEqualTo("classpath:taxonomy/does-not-exist.yml"));
  }

  @Test
  @DisplayName("Should fail on unparsable YAML")
  void shouldFailOnMalformedYaml() {
    assertThatThrownBy(() -> loader.load("classpath:taxonomy/malformed.yml"))
        .isInstanceOf(TaxonomyConfigurationException.class)
        .hasMessageContaining("Failed to parse taxonomy");
  }

  @Test
  @DisplayName("Should fail on invalid definitions")
  void shouldFailOnInvalidDefinitions() {
    assertThatThrownBy(() -> loader.load("classpath:taxonomy/negative-weight.yml"))
        .isInstanceOf(TaxonomyConfigurationException.class);
    assertThatThrownBy(() -> loader.load("classpath:taxonomy/empty-group.yml"))
        .isInstanceOf(TaxonomyConfigurationException.class);
  }

  @Test
  @DisplayName("Should map unknown categories to OTHER with weight 1.0")
  void shouldMapUnknownCategoriesToOther() {
    DomainTaxonomy taxonomy = loader.load("classpath:taxonomy/unknown-category.yml");

    TaxonomyTerm zodiac = taxonomy.lookup("zodiac").orElseThrow();
    assertThat(zodiac.category()).isEqualTo(TopicCategory.OTHER);
    assertThat(zodiac.weight()).isEqualTo(1.0);
    assertThat(taxonomy.weightOf(TopicCategory.ALGORITHMS)).isEqualTo(1.4);
  }
}
