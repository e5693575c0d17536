package com.flamingo.ai.interviewinsights.taxonomy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flamingo.ai.interviewinsights.exception.TaxonomyConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/** Reads the domain taxonomy from a YAML resource. */
@Slf4j
@Component
public class TaxonomyLoader {

  private final ResourceLoader resourceLoader;
  private final ObjectMapper yamlMapper;

  public TaxonomyLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
    this.yamlMapper = new ObjectMapper(new YAMLFactory());
    this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Loads and validates the taxonomy.
   *
   * @param location Spring resource location, e.g. {@code classpath:taxonomy.yml}
   * @return the immutable taxonomy
   * @throws TaxonomyConfigurationException when the resource is missing, unreadable or invalid
   */
  public DomainTaxonomy load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new TaxonomyConfigurationException(location, "Taxonomy resource not found: " + location);
    }

    TaxonomyDefinition definition;
    try (InputStream in = resource.getInputStream()) {
      definition = yamlMapper.readValue(in, TaxonomyDefinition.class);
    } catch (IOException e) {
      throw new TaxonomyConfigurationException(
          location, "Failed to parse taxonomy " + location + ": " + e.getMessage(), e);
    }
    return DomainTaxonomy.from(definition, location);
  }
}
