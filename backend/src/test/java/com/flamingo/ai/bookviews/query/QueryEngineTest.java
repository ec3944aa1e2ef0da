package com.flamingo.ai.bookviews.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookviews.domain.SearchStrategy;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.embedding.EmbeddingAdapter;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.flamingo.ai.bookviews.exception.TransientServiceException;
import com.flamingo.ai.bookviews.indexing.VectorHit;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryEngine Tests")
class QueryEngineTest {

  private static final float[] QUERY_VECTOR = {0.1f, 0.2f, 0.3f};

  @Mock private EmbeddingAdapter embeddingAdapter;
  @Mock private VectorIndex vectorIndex;

  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private QueryEngine queryEngine;
  private Map<SummaryView, Callable<List<VectorHit>>> searches;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(4);
    queryEngine =
        new QueryEngine(
            embeddingAdapter, vectorIndex, meterRegistry, executor, Duration.ofMillis(500), 50);
    searches = new EnumMap<>(SummaryView.class);
    for (SummaryView view : SummaryView.values()) {
      searches.put(view, List::of);
    }
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private void stubSearches() {
    when(embeddingAdapter.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
    when(vectorIndex.knnSearch(any(SummaryView.class), any(float[].class), anyInt(), any()))
        .thenAnswer(invocation -> searches.get(invocation.<SummaryView>getArgument(0)).call());
  }

  private static VectorHit hit(String id, double score, String combinedSummary) {
    return new VectorHit(id, score, "Title " + id, "Author " + id, combinedSummary, Map.of());
  }

  @Nested
  @DisplayName("multi-view strategy")
  class MultiViewTests {

    @Test
    @DisplayName("should score a book by its best view")
    void shouldMaxPoolAcrossViews() {
      searches.put(SummaryView.THEMATIC, () -> List.of(hit("moby-dick", 0.91, "obsession")));
      searches.put(SummaryView.PLOT, () -> List.of(hit("moby-dick", 0.40, "obsession")));
      stubSearches();

      RankedResults results =
          queryEngine.query(new QueryRequest("obsessive revenge at sea", SearchStrategy.MULTI, 5));

      assertThat(results.degraded()).isFalse();
      assertThat(results.results()).hasSize(1);
      Recommendation top = results.results().get(0);
      assertThat(top.id()).isEqualTo("moby-dick");
      assertThat(top.score()).isEqualTo(0.91);
      assertThat(top.matchedView()).isEqualTo(SummaryView.THEMATIC);
    }

    @Test
    @DisplayName("should rank merged books by descending score and cap at size")
    void shouldRankAndCap() {
      searches.put(
          SummaryView.PLOT, () -> List.of(hit("a", 0.5, ""), hit("b", 0.7, ""), hit("c", 0.2, "")));
      searches.put(SummaryView.CHARACTER, () -> List.of(hit("c", 0.9, ""), hit("d", 0.1, "")));
      stubSearches();

      RankedResults results = queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 3));

      assertThat(results.results()).extracting(Recommendation::id).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("should drop a failing view and flag the response as degraded")
    void shouldDegrade_whenOneViewFails() {
      searches.put(
          SummaryView.PLOT,
          () -> {
            throw new IllegalStateException("shard failure");
          });
      searches.put(SummaryView.COMBINED, () -> List.of(hit("emma", 0.8, "")));
      stubSearches();

      RankedResults results = queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 5));

      assertThat(results.degraded()).isTrue();
      assertThat(results.droppedViews()).containsExactly(SummaryView.PLOT);
      assertThat(results.results()).extracting(Recommendation::id).containsExactly("emma");
      assertThat(meterRegistry.counter("query.view.degraded").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should drop a view that misses the deadline")
    void shouldDegrade_whenViewTimesOut() {
      searches.put(
          SummaryView.CHARACTER,
          () -> {
            Thread.sleep(5_000);
            return List.of(hit("late", 0.99, ""));
          });
      searches.put(SummaryView.THEMATIC, () -> List.of(hit("emma", 0.6, "")));
      stubSearches();

      RankedResults results = queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 5));

      assertThat(results.degraded()).isTrue();
      assertThat(results.droppedViews()).containsExactly(SummaryView.CHARACTER);
      assertThat(results.results()).extracting(Recommendation::id).containsExactly("emma");
    }

    @Test
    @DisplayName("should fail when every view fails")
    void shouldFail_whenAllViewsFail() {
      for (SummaryView view : SummaryView.values()) {
        searches.put(
            view,
            () -> {
              throw new IllegalStateException("cluster down");
            });
      }
      stubSearches();

      assertThatThrownBy(() -> queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 5)))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("All 4 view searches failed");
    }

    @Test
    @DisplayName("should cancel submitted searches when the pool refuses more work")
    void shouldCancelSubmitted_whenExecutorSaturated() throws Exception {
      CountDownLatch neverReleased = new CountDownLatch(1);
      for (SummaryView view : SummaryView.values()) {
        searches.put(
            view,
            () -> {
              neverReleased.await(5, TimeUnit.SECONDS);
              return List.of();
            });
      }
      when(embeddingAdapter.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
      lenient()
          .when(vectorIndex.knnSearch(any(SummaryView.class), any(float[].class), anyInt(), any()))
          .thenAnswer(invocation -> searches.get(invocation.<SummaryView>getArgument(0)).call());
      ExecutorService saturated =
          new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>());
      try {
        QueryEngine engine =
            new QueryEngine(
                embeddingAdapter, vectorIndex, meterRegistry, saturated, Duration.ofMillis(500), 50);

        assertThatThrownBy(() -> engine.query(new QueryRequest("q", SearchStrategy.MULTI, 5)))
            .isInstanceOf(SearchException.class)
            .hasMessageContaining("capacity exhausted");

        saturated.shutdown();
        assertThat(saturated.awaitTermination(1, TimeUnit.SECONDS)).isTrue();
        assertThat(meterRegistry.counter("query.rejected").count()).isEqualTo(1.0);
      } finally {
        saturated.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("single-view strategies")
  class SingleViewTests {

    @Test
    @DisplayName("should search only the requested view")
    void shouldSearchOnlyRequestedView() {
      searches.put(SummaryView.CHARACTER, () -> List.of(hit("jane-eyre", 0.77, "")));
      stubSearches();

      RankedResults results =
          queryEngine.query(new QueryRequest("a governess", SearchStrategy.CHARACTER, 5, "books"));

      assertThat(results.results()).extracting(Recommendation::matchedView)
          .containsExactly(SummaryView.CHARACTER);
      verify(vectorIndex).knnSearch(eq(SummaryView.CHARACTER), any(float[].class), eq(5), eq("books"));
      verify(vectorIndex, never())
          .knnSearch(eq(SummaryView.PLOT), any(float[].class), anyInt(), any());
    }

    @Test
    @DisplayName("should fail the query when its only view fails")
    void shouldFail_whenSingleViewFails() {
      searches.put(
          SummaryView.PLOT,
          () -> {
            throw new IllegalStateException("timeout");
          });
      stubSearches();

      assertThatThrownBy(() -> queryEngine.query(new QueryRequest("q", SearchStrategy.PLOT, 5)))
          .isInstanceOf(SearchException.class);
    }
  }

  @Nested
  @DisplayName("validation and embedding")
  class ValidationTests {

    @Test
    @DisplayName("should reject a blank query before embedding")
    void shouldRejectBlankQuery() {
      assertThatThrownBy(() -> queryEngine.query(new QueryRequest("  ", SearchStrategy.MULTI, 5)))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(embeddingAdapter, vectorIndex);
    }

    @Test
    @DisplayName("should reject a size above the maximum")
    void shouldRejectOversizedRequest() {
      assertThatThrownBy(() -> queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 51)))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(embeddingAdapter);
    }

    @Test
    @DisplayName("should surface an embedding outage as a search error")
    void shouldWrapEmbeddingFailure() {
      when(embeddingAdapter.embedQuery(anyString()))
          .thenThrow(new TransientServiceException("unavailable", 4, null));

      assertThatThrownBy(() -> queryEngine.query(new QueryRequest("q", SearchStrategy.MULTI, 5)))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("Could not embed query");
      verifyNoInteractions(vectorIndex);
    }
  }
}
