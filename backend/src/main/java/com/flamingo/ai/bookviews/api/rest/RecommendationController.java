package com.flamingo.ai.bookviews.api.rest;

import com.flamingo.ai.bookviews.api.dto.request.RecommendationRequest;
import com.flamingo.ai.bookviews.api.dto.response.RecommendationResponse;
import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.SearchStrategy;
import com.flamingo.ai.bookviews.query.QueryEngine;
import com.flamingo.ai.bookviews.query.QueryRequest;
import com.flamingo.ai.bookviews.query.RankedResults;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for book recommendations. */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

  private final QueryEngine queryEngine;
  private final PipelineConfig pipelineConfig;

  /** Recommends books for a natural-language query. */
  @PostMapping
  public ResponseEntity<RecommendationResponse> recommend(
      @Valid @RequestBody RecommendationRequest request) {
    SearchStrategy strategy =
        request.getStrategy() == null || request.getStrategy().isBlank()
            ? SearchStrategy.MULTI
            : SearchStrategy.fromValue(request.getStrategy());
    int size =
        request.getSize() != null ? request.getSize() : pipelineConfig.getQuery().getDefaultSize();

    RankedResults results =
        queryEngine.query(new QueryRequest(request.getQuery(), strategy, size, request.getCorpus()));
    return ResponseEntity.ok(RecommendationResponse.fromResults(results));
  }
}
