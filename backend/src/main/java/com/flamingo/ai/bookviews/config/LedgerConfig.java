package com.flamingo.ai.bookviews.config;

import com.flamingo.ai.bookviews.ledger.CheckpointLedger;
import com.flamingo.ai.bookviews.ledger.InMemoryCheckpointLedger;
import com.flamingo.ai.bookviews.ledger.JsonFileCheckpointStore;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the checkpoint ledger and recovers its state from the last snapshot. */
@Configuration
@Slf4j
public class LedgerConfig {

  @Bean
  public CheckpointLedger checkpointLedger(PipelineConfig config) {
    PipelineConfig.Ingestion ingestion = config.getIngestion();
    JsonFileCheckpointStore store = new JsonFileCheckpointStore(Path.of(ingestion.getLedgerPath()));
    InMemoryCheckpointLedger ledger =
        new InMemoryCheckpointLedger(store, ingestion.getMaxAttempts());
    int restored = ledger.restore();
    log.info("Checkpoint ledger at {} restored with {} entries", store.getFile(), restored);
    return ledger;
  }
}
