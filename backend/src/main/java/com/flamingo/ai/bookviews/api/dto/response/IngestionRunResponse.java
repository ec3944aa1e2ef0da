package com.flamingo.ai.bookviews.api.dto.response;

import com.flamingo.ai.bookviews.domain.CheckpointStatus;
import com.flamingo.ai.bookviews.ingestion.IngestionRun;
import com.flamingo.ai.bookviews.ingestion.IngestionStats;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Response DTO describing an ingestion run and the ledger it works against. */
@Data
@Builder
public class IngestionRunResponse {

  private String runId;
  private String corpusPrefix;
  private String state;
  private Instant startedAt;
  private Instant finishedAt;
  private IngestionStats stats;
  private String error;
  private Map<CheckpointStatus, Long> ledger;

  public static IngestionRunResponse fromRun(
      IngestionRun run, Map<CheckpointStatus, Long> ledgerCounts) {
    return IngestionRunResponse.builder()
        .runId(run.getId())
        .corpusPrefix(run.getCorpusPrefix())
        .state(run.getState().name())
        .startedAt(run.getStartedAt())
        .finishedAt(run.getFinishedAt())
        .stats(run.getStats())
        .error(run.getError())
        .ledger(ledgerCounts)
        .build();
  }
}
