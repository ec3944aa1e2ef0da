package com.flamingo.ai.bookviews.config;

import com.flamingo.ai.bookviews.retry.RetryPolicy;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and query pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Chunking chunking = new Chunking();
  private Summary summary = new Summary();
  private Embedding embedding = new Embedding();
  private Ingestion ingestion = new Ingestion();
  private Indexing indexing = new Indexing();
  private Query query = new Query();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 8000;
    private int overlap = 500;

    /** Characters past {@code size} searched for a sentence terminal before hard-cutting. */
    private int lookahead = 200;

    /** Chunk size used when a reduce pass re-chunks concatenated digests. */
    private int reduceSize = 6000;

    private int reduceOverlap = 200;
  }

  @Getter
  @Setter
  public static class Summary {
    private int minLength = 200;
    private int maxLength = 2000;

    /** Concatenated digests longer than this are reduced recursively. */
    private int reduceThreshold = 6000;

    private int maxDepth = 4;

    /** Per-document cap on concurrent map-phase LLM calls. */
    private int chunkConcurrency = 4;

    private int excerptLength = 500;
    private boolean persistArtifacts = true;
    private String artifactPrefix = "book-summaries/";
  }

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 1536;
    private int maxInputChars = 24000;
    private RetrySettings retry = new RetrySettings();
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int workers = 2;

    /** Documents claimed from the ledger per worker iteration. */
    private int claimBatchSize = 4;

    private int maxAttempts = 3;
    private String corpusPrefix = "books/";
    private String documentSuffix = ".txt";
    private String ledgerPath = "data/ledger.json";
    private boolean runOnStartup = false;
    private boolean reconcile = true;
  }

  @Getter
  @Setter
  public static class Indexing {
    private String indexName = "book-views";
    private int batchSize = 50;
    private Duration flushInterval = Duration.ofSeconds(2);
    private RetrySettings retry = new RetrySettings();
  }

  @Getter
  @Setter
  public static class Query {
    private int defaultSize = 5;
    private int maxSize = 50;
    private Duration timeout = Duration.ofSeconds(5);
    private int candidatesMultiplier = 2;
  }

  @Getter
  @Setter
  public static class Storage {
    private String root = "data/blobs";
  }

  @Getter
  @Setter
  public static class RetrySettings {
    private int maxAttempts = 4;
    private Duration baseDelay = Duration.ofMillis(500);
    private Duration maxDelay = Duration.ofSeconds(20);
    private double multiplier = 2.0;
    private double jitter = 0.5;

    public RetryPolicy toPolicy() {
      return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, jitter);
    }
  }
}
