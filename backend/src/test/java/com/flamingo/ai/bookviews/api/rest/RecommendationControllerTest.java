package com.flamingo.ai.bookviews.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.SearchStrategy;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.exception.ApiError;
import com.flamingo.ai.bookviews.exception.GlobalExceptionHandler;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.flamingo.ai.bookviews.query.QueryEngine;
import com.flamingo.ai.bookviews.query.QueryRequest;
import com.flamingo.ai.bookviews.query.RankedResults;
import com.flamingo.ai.bookviews.query.Recommendation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationController Tests")
class RecommendationControllerTest {

  @Mock private QueryEngine queryEngine;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    RecommendationController controller =
        new RecommendationController(queryEngine, new PipelineConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private static RankedResults results(SearchStrategy strategy) {
    Recommendation moby =
        new Recommendation(
            "moby-dick",
            0.91,
            "Moby Dick",
            "Herman Melville",
            Map.of("sourceKey", "books/Moby-Dick.txt"),
            SummaryView.THEMATIC);
    return new RankedResults("obsession at sea", strategy, List.of(moby), false, List.of());
  }

  @Test
  @DisplayName("should default to the multi-view strategy and the configured size")
  void shouldApplyDefaults() throws Exception {
    when(queryEngine.query(any())).thenReturn(results(SearchStrategy.MULTI));

    mockMvc
        .perform(
            post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"obsession at sea\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.strategy").value("multi"))
        .andExpect(jsonPath("$.totalResults").value(1))
        .andExpect(jsonPath("$.recommendations[0].id").value("moby-dick"))
        .andExpect(jsonPath("$.recommendations[0].matchedView").value("thematic"))
        .andExpect(jsonPath("$.recommendations[0].metadata.sourceKey").value("books/Moby-Dick.txt"));

    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(queryEngine).query(captor.capture());
    assertThat(captor.getValue().strategy()).isEqualTo(SearchStrategy.MULTI);
    assertThat(captor.getValue().size()).isEqualTo(5);
  }

  @Test
  @DisplayName("should pass an explicit strategy, size and corpus through")
  void shouldPassExplicitParameters() throws Exception {
    when(queryEngine.query(any())).thenReturn(results(SearchStrategy.PLOT));

    mockMvc
        .perform(
            post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"query\":\"a whale hunt\",\"strategy\":\"PLOT\",\"size\":3,\"corpus\":\"books\"}"))
        .andExpect(status().isOk());

    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(queryEngine).query(captor.capture());
    assertThat(captor.getValue())
        .isEqualTo(new QueryRequest("a whale hunt", SearchStrategy.PLOT, 3, "books"));
  }

  @Test
  @DisplayName("should reject an empty query with 400")
  void shouldRejectEmptyQuery() throws Exception {
    mockMvc
        .perform(
            post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verifyNoInteractions(queryEngine);
  }

  @Test
  @DisplayName("should reject an unknown strategy with 400")
  void shouldRejectUnknownStrategy() throws Exception {
    mockMvc
        .perform(
            post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"q\",\"strategy\":\"mood\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Unknown search strategy: mood"));
  }

  @Test
  @DisplayName("should answer 503 when search is unavailable")
  void shouldReturnServiceUnavailable_onSearchFailure() throws Exception {
    when(queryEngine.query(any())).thenThrow(new SearchException("All 4 view searches failed"));

    mockMvc
        .perform(
            post("/api/recommendations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"q\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value(ApiError.SEARCH_FAILED))
        .andExpect(jsonPath("$.path").value("/api/recommendations"));
  }
}
