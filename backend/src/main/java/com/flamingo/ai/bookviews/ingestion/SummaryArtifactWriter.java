package com.flamingo.ai.bookviews.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.SourceDocument;
import com.flamingo.ai.bookviews.domain.SummaryBundle;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.storage.BlobStore;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Persists each finished summary bundle as JSON next to the corpus, for audit. */
@Component
@Slf4j
public class SummaryArtifactWriter {

  private final BlobStore blobStore;
  private final ObjectMapper objectMapper;
  private final String prefix;
  private final String summaryModelId;
  private final String embeddingModelId;

  public SummaryArtifactWriter(
      BlobStore blobStore,
      ObjectMapper objectMapper,
      PipelineConfig config,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}") String summaryModelId,
      @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
          String embeddingModelId) {
    this.blobStore = blobStore;
    this.objectMapper = objectMapper;
    this.prefix = config.getSummary().getArtifactPrefix();
    this.summaryModelId = summaryModelId;
    this.embeddingModelId = embeddingModelId;
  }

  /** Writes the artifact and returns its key. */
  public String write(SourceDocument document, SummaryBundle bundle, Instant generatedAt)
      throws IOException {
    Map<String, Object> artifact = new LinkedHashMap<>();
    artifact.put("documentId", document.id());
    artifact.put("bookTitle", document.title());
    artifact.put("author", document.author());
    artifact.put("sourceKey", document.sourceKey());
    artifact.put("contentChecksum", document.contentChecksum());
    artifact.put("summaryModelId", summaryModelId);
    artifact.put("embeddingModelId", embeddingModelId);
    for (SummaryView view : SummaryView.values()) {
      artifact.put(view.summaryField(), bundle.summary(view));
    }
    artifact.put("description", bundle.excerpt());
    artifact.put("totalChunks", bundle.totalChunks());
    artifact.put("generatedAt", generatedAt.toString());

    String key = prefix + GutenbergTextCleaner.slugify(document.title()) + "-summary.json";
    blobStore.put(key, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(artifact));
    log.debug("Wrote summary artifact {} for {}", key, document.id());
    return key;
  }

  public String getSummaryModelId() {
    return summaryModelId;
  }

  public String getEmbeddingModelId() {
    return embeddingModelId;
  }
}
