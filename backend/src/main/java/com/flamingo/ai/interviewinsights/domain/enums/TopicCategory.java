package com.flamingo.ai.interviewinsights.domain.enums;

import java.util.Locale;

/**
 * Closed set of subject categories a topic can belong to.
 *
 * <p>Weights for the named categories come from the taxonomy file. {@link #OTHER} is the bucket for
 * unrecognized category keys and uncategorized terms; its weight is always 1.0.
 */
public enum TopicCategory {
  SYSTEM_DESIGN("system_design", "System Design"),
  DATA_STRUCTURES("data_structures", "Data Structures"),
  ALGORITHMS("algorithms", "Algorithms"),
  PROGRAMMING_CONCEPTS("programming_concepts", "Programming Concepts"),
  TECHNOLOGIES("technologies", "Technologies"),
  BEHAVIORAL("behavioral", "Behavioral"),
  OTHER("other", "Other");

  public static final double OTHER_WEIGHT = 1.0;

  private final String key;
  private final String displayName;

  TopicCategory(String key, String displayName) {
    this.key = key;
    this.displayName = displayName;
  }

  public String getKey() {
    return key;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Resolves a taxonomy category key. Dashes, spaces and case are ignored.
   *
   * @param key the key as written in the taxonomy file
   * @return the matching category, or {@link #OTHER} when the key is unknown
   */
  public static TopicCategory fromKey(String key) {
    if (key == null) {
      return OTHER;
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (TopicCategory category : values()) {
      if (category.key.equals(normalized)) {
        return category;
      }
    }
    return OTHER;
  }
}
