package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Starts a background ingestion of the configured corpus once the application is up. */
@Component
@ConditionalOnProperty(prefix = "pipeline.ingestion", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements CommandLineRunner {

  private final IngestionRunService runService;
  private final PipelineConfig config;

  @Override
  public void run(String... args) {
    String prefix = config.getIngestion().getCorpusPrefix();
    IngestionRun run = runService.start(prefix);
    log.info("Startup ingestion of {} scheduled as run {}", prefix, run.getId());
  }
}
