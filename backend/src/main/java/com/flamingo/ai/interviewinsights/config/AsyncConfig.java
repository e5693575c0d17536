package com.flamingo.ai.interviewinsights.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for running independent company analyses in parallel. When the queue is full the
 * submitting thread runs the analysis itself.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "companyAnalysisExecutor")
  public Executor companyAnalysisExecutor(InsightsConfig insightsConfig) {
    InsightsConfig.Async async = insightsConfig.getAsync();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(async.getCorePoolSize(), async.getMaxPoolSize()));
    executor.setQueueCapacity(async.getQueueCapacity());
    executor.setThreadNamePrefix("company-analysis-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
