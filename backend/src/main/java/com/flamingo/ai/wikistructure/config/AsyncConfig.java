package com.flamingo.ai.wikistructure.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the corpus worker pool; each task structures one document.
 *
 * <p>A corpus can be larger than the pool and its queue together, so a saturated pool runs the
 * task on the submitting thread instead of rejecting it.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "corpusProcessingExecutor")
  public Executor corpusProcessingExecutor(WikiConfig wikiConfig) {
    WikiConfig.Executor settings = wikiConfig.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix("corpus-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
