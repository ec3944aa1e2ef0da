package com.flamingo.ai.bookviews.api.rest;

import com.flamingo.ai.bookviews.api.dto.request.StartIngestionRequest;
import com.flamingo.ai.bookviews.api.dto.response.IngestionRunResponse;
import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.ingestion.CorpusPurge;
import com.flamingo.ai.bookviews.ingestion.IngestionRun;
import com.flamingo.ai.bookviews.ingestion.IngestionRunService;
import com.flamingo.ai.bookviews.ledger.CheckpointLedger;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingestion runs and index maintenance. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

  private final IngestionRunService runService;
  private final CheckpointLedger ledger;
  private final PipelineConfig pipelineConfig;

  /** Starts a background ingestion run. */
  @PostMapping("/ingestion/runs")
  public ResponseEntity<IngestionRunResponse> startRun(
      @RequestBody(required = false) StartIngestionRequest request) {
    String prefix =
        request == null || request.getCorpusPrefix() == null || request.getCorpusPrefix().isBlank()
            ? pipelineConfig.getIngestion().getCorpusPrefix()
            : request.getCorpusPrefix();
    IngestionRun run = runService.start(prefix);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(IngestionRunResponse.fromRun(run, ledger.countByStatus()));
  }

  /** Reports the latest run. */
  @GetMapping("/ingestion/runs/current")
  public ResponseEntity<IngestionRunResponse> currentRun() {
    return runService
        .current()
        .map(run -> ResponseEntity.ok(IngestionRunResponse.fromRun(run, ledger.countByStatus())))
        .orElse(ResponseEntity.notFound().build());
  }

  /** Requests cooperative cancellation of the active run. */
  @DeleteMapping("/ingestion/runs/current")
  public ResponseEntity<IngestionRunResponse> cancelRun() {
    return runService
        .cancelCurrent()
        .map(
            run ->
                ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(IngestionRunResponse.fromRun(run, ledger.countByStatus())))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Purges one corpus from the index, or every record when no corpus is given. The purged books
   * are pending again in the ledger.
   */
  @DeleteMapping("/index")
  public ResponseEntity<Map<String, Object>> purgeIndex(
      @RequestParam(required = false) String corpus) {
    log.info("Purge requested for corpus {}", corpus == null ? "*" : corpus);
    CorpusPurge purge = runService.purge(corpus == null || corpus.isBlank() ? null : corpus);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("corpus", purge.corpus() == null ? "*" : purge.corpus());
    body.put("deleted", purge.deleted());
    body.put("ledgerReset", purge.ledgerReset());
    return ResponseEntity.ok(body);
  }
}
