package com.flamingo.ai.bookviews.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the pipeline.
 *
 * <p>Document workers and map-phase summarization run on separate pools so that a worker waiting
 * on its chunk summaries never occupies a thread the summaries need.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor(PipelineConfig config) {
    int workers = config.getIngestion().getWorkers();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(workers);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "summaryExecutor")
  public ThreadPoolTaskExecutor summaryExecutor(PipelineConfig config) {
    int threads = config.getIngestion().getWorkers() * config.getSummary().getChunkConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("summary-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "queryExecutor")
  public ThreadPoolTaskExecutor queryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("query-");
    executor.initialize();
    return executor;
  }

  /** Drives the bulk indexer's time-based flush and background ingestion runs. */
  @Bean(name = "pipelineScheduler")
  public ThreadPoolTaskScheduler pipelineScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("pipeline-sched-");
    scheduler.initialize();
    return scheduler;
  }
}
