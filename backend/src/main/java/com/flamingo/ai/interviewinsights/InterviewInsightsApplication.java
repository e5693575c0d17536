package com.flamingo.ai.interviewinsights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Interview insights analytics engine. */
@SpringBootApplication
public class InterviewInsightsApplication {

  public static void main(String[] args) {
    SpringApplication.run(InterviewInsightsApplication.class, args);
  }
}
