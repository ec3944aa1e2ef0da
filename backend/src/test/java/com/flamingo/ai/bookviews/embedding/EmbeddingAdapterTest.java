package com.flamingo.ai.bookviews.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.PermanentContentException;
import com.flamingo.ai.bookviews.exception.TransientServiceException;
import com.flamingo.ai.bookviews.retry.RetryPolicy;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingAdapter Tests")
class EmbeddingAdapterTest {

  private static final int DIMENSIONS = 3;

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingAdapter adapter;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    adapter = new EmbeddingAdapter(embeddingModel, meterRegistry, DIMENSIONS, 100, policy);
  }

  private static Response<Embedding> vector(float... values) {
    return Response.from(Embedding.from(values));
  }

  @Nested
  @DisplayName("embed")
  class EmbedTests {

    @Test
    @DisplayName("should return the model vector")
    void shouldReturnVector() {
      when(embeddingModel.embed(anyString())).thenReturn(vector(0.1f, 0.2f, 0.3f));

      float[] result = adapter.embed("A whaling voyage.");

      assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
      assertThat(
              meterRegistry
                  .counter("embedding.requests", "type", "passage", "outcome", "success")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should embed query text the same way")
    void shouldEmbedQuery() {
      when(embeddingModel.embed("sea adventure")).thenReturn(vector(1f, 0f, 0f));

      assertThat(adapter.embedQuery("sea adventure")).containsExactly(1f, 0f, 0f);
    }

    @Test
    @DisplayName("should reject blank input without calling the model")
    void shouldRejectBlankInput() {
      assertThatThrownBy(() -> adapter.embed("   ")).isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(embeddingModel);
    }

    @Test
    @DisplayName("should reject input above the limit instead of truncating it")
    void shouldRejectOverlongInput() {
      assertThatThrownBy(() -> adapter.embed("x".repeat(101)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("truncate upstream");
      verifyNoInteractions(embeddingModel);
    }
  }

  @Nested
  @DisplayName("retries")
  class RetryTests {

    @Test
    @DisplayName("should succeed after a transient failure")
    void shouldSucceed_afterRateLimit() {
      when(embeddingModel.embed(anyString()))
          .thenThrow(new RateLimitException("429"))
          .thenReturn(vector(0.5f, 0.5f, 0.5f));

      float[] result = adapter.embed("text");

      assertThat(result).containsExactly(0.5f, 0.5f, 0.5f);
      verify(embeddingModel, times(2)).embed(anyString());
    }

    @Test
    @DisplayName("should raise a transient error once attempts are exhausted")
    void shouldRaiseTransient_whenAttemptsExhausted() {
      when(embeddingModel.embed(anyString())).thenThrow(new RateLimitException("429"));

      assertThatThrownBy(() -> adapter.embed("text"))
          .isInstanceOfSatisfying(
              TransientServiceException.class,
              e -> assertThat(e.getAttempts()).isEqualTo(3))
          .hasMessageContaining("after 3 attempts");
      verify(embeddingModel, times(3)).embed(anyString());
    }

    @Test
    @DisplayName("should retry socket timeouts")
    void shouldRetryTimeouts() {
      when(embeddingModel.embed(anyString()))
          .thenThrow(new RuntimeException("io", new SocketTimeoutException("read timed out")))
          .thenReturn(vector(1f, 2f, 3f));

      assertThat(adapter.embed("text")).containsExactly(1f, 2f, 3f);
    }

    @Test
    @DisplayName("should treat an empty response as transient")
    void shouldRetryEmptyResponse() {
      when(embeddingModel.embed(anyString())).thenReturn(null).thenReturn(vector(1f, 2f, 3f));

      assertThat(adapter.embed("text")).containsExactly(1f, 2f, 3f);
      verify(embeddingModel, times(2)).embed(anyString());
    }
  }

  @Nested
  @DisplayName("non-retryable failures")
  class NonRetryableTests {

    @Test
    @DisplayName("should fail fast on a dimension mismatch")
    void shouldFailOnDimensionMismatch() {
      when(embeddingModel.embed(anyString())).thenReturn(vector(0.1f, 0.2f));

      assertThatThrownBy(() -> adapter.embed("text"))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("dimension mismatch");
      verify(embeddingModel, times(1)).embed(anyString());
    }

    @Test
    @DisplayName("should fail fast on rejected credentials")
    void shouldFailOnAuthentication() {
      when(embeddingModel.embed(anyString())).thenThrow(new AuthenticationException("401"));

      assertThatThrownBy(() -> adapter.embed("text")).isInstanceOf(ConfigurationException.class);
      verify(embeddingModel, times(1)).embed(anyString());
    }

    @Test
    @DisplayName("should classify rejected input as a content error")
    void shouldClassifyInvalidRequest() {
      when(embeddingModel.embed(anyString())).thenThrow(new InvalidRequestException("bad input"));

      assertThatThrownBy(() -> adapter.embed("text"))
          .isInstanceOf(PermanentContentException.class);
      verify(embeddingModel, times(1)).embed(anyString());
    }
  }
}
