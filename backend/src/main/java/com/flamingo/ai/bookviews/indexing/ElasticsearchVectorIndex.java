package com.flamingo.ai.bookviews.indexing;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.IndexRecord;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed vector index. Each book is one document whose id is the source document id;
 * every view contributes a {@code <view>Summary} text field and a {@code <view>Embedding} cosine
 * {@code dense_vector} field.
 */
@Service
@Slf4j
public class ElasticsearchVectorIndex implements VectorIndex {

  static final String CORPUS_FIELD = "corpus";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;
  private final int candidatesMultiplier;

  @Autowired
  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      PipelineConfig config) {
    this(
        elasticsearchClient,
        meterRegistry,
        config.getIndexing().getIndexName(),
        config.getEmbedding().getDimensions(),
        config.getQuery().getCandidatesMultiplier());
  }

  @VisibleForTesting
  ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions,
      int candidatesMultiplier) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.candidatesMultiplier = candidatesMultiplier;
  }

  /** Creates the index if missing, otherwise verifies that every view's vector field fits. */
  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping initialization of {}", indexName);
        return;
      }
      if (indices.exists(e -> e.index(indexName)).value()) {
        validateMappings();
      } else {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(defineProperties())));
        indices.create(request);
        log.info("Created vector index {} with {} dimensions", indexName, vectorDimensions);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to initialize vector index '" + indexName + "'", e);
    }
  }

  /** Dimension or type drift cannot be fixed in place; the index must be recreated. */
  private void validateMappings() throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(indexName));
    var mapping = response.get(indexName);
    if (mapping == null) {
      return;
    }
    Map<String, Property> actual = mapping.mappings().properties();
    for (SummaryView view : SummaryView.values()) {
      Property property = actual.get(view.embeddingField());
      if (property == null) {
        throw new ConfigurationException(
            "Index '" + indexName + "' has no vector field " + view.embeddingField());
      }
      if (!property.isDenseVector()) {
        throw new ConfigurationException(
            "Field "
                + view.embeddingField()
                + " in '"
                + indexName
                + "' is "
                + property._kind()
                + ", expected dense_vector");
      }
      Integer dims = property.denseVector().dims();
      if (dims != null && dims != vectorDimensions) {
        throw new ConfigurationException(
            "Field "
                + view.embeddingField()
                + " has "
                + dims
                + " dimensions but the embedding model produces "
                + vectorDimensions
                + ". Purge and recreate the index.");
      }
    }
    log.debug("Index '{}' mapping verified", indexName);
  }

  private Map<String, Property> defineProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("author", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(CORPUS_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentChecksum", Property.of(p -> p.keyword(k -> k)));
    properties.put("summaryModelId", Property.of(p -> p.keyword(k -> k)));
    properties.put("embeddingModelId", Property.of(p -> p.keyword(k -> k)));
    properties.put("totalChunks", Property.of(p -> p.integer(i -> i)));
    properties.put("generatedAt", Property.of(p -> p.date(d -> d)));
    properties.put("description", Property.of(p -> p.text(TextProperty.of(t -> t.index(false)))));
    for (SummaryView view : SummaryView.values()) {
      properties.put(view.summaryField(), Property.of(p -> p.text(TextProperty.of(t -> t))));
      properties.put(
          view.embeddingField(),
          Property.of(
              p ->
                  p.denseVector(
                      DenseVectorProperty.of(
                          d ->
                              d.dims(vectorDimensions)
                                  .index(true)
                                  .similarity(DenseVectorSimilarity.Cosine)))));
    }
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.bulk_upsert", description = "Time for one bulk upsert request")
  public BulkUpsertResult bulkUpsert(List<IndexRecord> records) throws IOException {
    if (records.isEmpty()) {
      return BulkUpsertResult.success();
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (IndexRecord record : records) {
      Map<String, Object> document = toDocument(record);
      bulk.operations(op -> op.index(idx -> idx.index(indexName).id(record.id()).document(document)));
    }

    BulkResponse response = elasticsearchClient.bulk(bulk.build());
    Map<Integer, String> failures = new LinkedHashMap<>();
    if (response.errors()) {
      List<BulkResponseItem> items = response.items();
      for (int i = 0; i < items.size(); i++) {
        BulkResponseItem item = items.get(i);
        if (item.error() != null) {
          String reason = item.error().reason();
          failures.put(i, reason != null ? reason : item.error().type());
        }
      }
    }
    meterRegistry
        .counter("indexing.bulk.items", "outcome", "indexed")
        .increment(records.size() - failures.size());
    if (!failures.isEmpty()) {
      meterRegistry.counter("indexing.bulk.items", "outcome", "rejected").increment(failures.size());
      log.warn("{} of {} items rejected by {}", failures.size(), records.size(), indexName);
    }
    return new BulkUpsertResult(failures);
  }

  @Override
  @Timed(value = "elasticsearch.knn_search", description = "Time for one k-NN view search")
  @CircuitBreaker(name = "elasticsearch")
  public List<VectorHit> knnSearch(SummaryView view, float[] vector, int k, String corpus) {
    List<Float> queryVector = toFloatList(vector);
    SearchRequest request =
        SearchRequest.of(
            s -> {
              s.index(indexName)
                  .knn(
                      knn -> {
                        knn.field(view.embeddingField())
                            .queryVector(queryVector)
                            .k(k)
                            .numCandidates(Math.max(k * candidatesMultiplier, k));
                        if (corpus != null) {
                          knn.filter(f -> f.term(t -> t.field(CORPUS_FIELD).value(corpus)));
                        }
                        return knn;
                      })
                  .source(
                      src ->
                          src.filter(
                              f -> f.excludes(embeddingFields())))
                  .size(k);
              return s;
            });
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<VectorHit> hits = mapHits(response.hits().hits());
      log.debug("[knn] index={} view={} k={} returned={}", indexName, view.getValue(), k, hits.size());
      return hits;
    } catch (IOException e) {
      throw new SearchException("k-NN search failed on " + view.embeddingField(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
    } catch (IOException e) {
      throw new SearchException("Refresh failed on " + indexName, e);
    }
  }

  @Override
  public long count(String corpus) {
    try {
      return elasticsearchClient
          .count(c -> c.index(indexName).query(corpusQuery(corpus)))
          .count();
    } catch (IOException e) {
      throw new SearchException("Count failed on " + indexName, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.purge", description = "Time to purge records")
  public long purge(String corpus) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(indexName).query(corpusQuery(corpus)).refresh(true));
      Long deleted = elasticsearchClient.deleteByQuery(request).deleted();
      log.info("Purged {} records from {} (corpus={})", deleted, indexName, corpus);
      return deleted != null ? deleted : 0L;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to purge " + indexName, e);
    }
  }

  private static Query corpusQuery(String corpus) {
    if (corpus == null) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    return Query.of(q -> q.term(t -> t.field(CORPUS_FIELD).value(corpus)));
  }

  private static List<String> embeddingFields() {
    List<String> fields = new ArrayList<>();
    for (SummaryView view : SummaryView.values()) {
      fields.add(view.embeddingField());
    }
    return fields;
  }

  private static Map<String, Object> toDocument(IndexRecord record) {
    Map<String, Object> document = new HashMap<>(record.metadata());
    document.put("title", record.title());
    document.put("author", record.author());
    document.put(CORPUS_FIELD, record.corpus());
    record
        .views()
        .forEach(
            (view, payload) -> {
              document.put(view.summaryField(), payload.summary());
              document.put(view.embeddingField(), toFloatList(payload.embedding()));
            });
    return document;
  }

  /** Elasticsearch reports cosine k-NN scores as {@code (1 + cos) / 2}; convert back to cosine. */
  @SuppressWarnings("unchecked")
  @VisibleForTesting
  static List<VectorHit> mapHits(List<Hit<Map>> hits) {
    List<VectorHit> results = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null || hit.score() == null) {
        continue;
      }
      Map<String, Object> metadata = new LinkedHashMap<>(source);
      Object title = metadata.remove("title");
      Object author = metadata.remove("author");
      Object combined = metadata.get(SummaryView.COMBINED.summaryField());
      for (SummaryView view : SummaryView.values()) {
        metadata.remove(view.summaryField());
        metadata.remove(view.embeddingField());
      }
      results.add(
          new VectorHit(
              hit.id(),
              2 * hit.score() - 1,
              title != null ? title.toString() : null,
              author != null ? author.toString() : null,
              combined != null ? combined.toString() : "",
              metadata));
    }
    return results;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
