package com.flamingo.ai.interviewinsights.exception;

/** Exception thrown when the domain taxonomy is missing or invalid at startup. */
public class TaxonomyConfigurationException extends RuntimeException {

  private final String location;
  private final String userMessage;

  public TaxonomyConfigurationException(String location, String message) {
    super(message);
    this.location = location;
    this.userMessage = "Topic taxonomy could not be loaded";
  }

  public TaxonomyConfigurationException(String location, String message, Throwable cause) {
    super(message, cause);
    this.location = location;
    this.userMessage = "Topic taxonomy could not be loaded";
  }

  public String getLocation() {
    return location;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
