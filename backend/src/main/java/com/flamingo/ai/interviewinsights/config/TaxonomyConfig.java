package com.flamingo.ai.interviewinsights.config;

import com.flamingo.ai.interviewinsights.exception.TaxonomyConfigurationException;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.taxonomy.TaxonomyLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Loads the domain taxonomy once at startup; an unusable taxonomy aborts the application. */
@Slf4j
@Configuration
public class TaxonomyConfig {

  @Bean
  public DomainTaxonomy domainTaxonomy(TaxonomyLoader taxonomyLoader, InsightsConfig insightsConfig) {
    String location = insightsConfig.getTaxonomy().getLocation();
    try {
      return taxonomyLoader.load(location);
    } catch (TaxonomyConfigurationException e) {
      log.error("Cannot start without a valid taxonomy at {}: {}", location, e.getMessage());
      throw e;
    }
  }
}
