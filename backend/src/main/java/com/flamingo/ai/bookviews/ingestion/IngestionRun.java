package com.flamingo.ai.bookviews.ingestion;

import java.time.Instant;
import java.util.UUID;

/** A background ingestion run started from the API or at startup. */
public class IngestionRun {

  /** Lifecycle of a background run. */
  public enum State {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
  }

  private final String id = UUID.randomUUID().toString();
  private final String corpusPrefix;
  private final Instant startedAt = Instant.now();
  private final IngestionContext context = new IngestionContext();

  private volatile State state = State.RUNNING;
  private volatile Instant finishedAt;
  private volatile IngestionStats stats;
  private volatile String error;

  IngestionRun(String corpusPrefix) {
    this.corpusPrefix = corpusPrefix;
  }

  void complete(IngestionStats result) {
    this.stats = result;
    this.state = result.cancelled() ? State.CANCELLED : State.COMPLETED;
    this.finishedAt = Instant.now();
  }

  void fail(Throwable cause) {
    this.error = cause.getMessage();
    this.state = State.FAILED;
    this.finishedAt = Instant.now();
  }

  public boolean isActive() {
    return state == State.RUNNING;
  }

  public String getId() {
    return id;
  }

  public String getCorpusPrefix() {
    return corpusPrefix;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public IngestionContext getContext() {
    return context;
  }

  public State getState() {
    return state;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public IngestionStats getStats() {
    return stats;
  }

  public String getError() {
    return error;
  }
}
