package com.flamingo.ai.bookviews.api.dto.response;

import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.query.RankedResults;
import com.flamingo.ai.bookviews.query.Recommendation;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Response DTO for a recommendation query. */
@Data
@Builder
public class RecommendationResponse {

  private String query;
  private String strategy;
  private int totalResults;
  private boolean degraded;
  private List<String> droppedViews;
  private List<Item> recommendations;

  /** One recommended book. */
  @Data
  @Builder
  public static class Item {
    private String id;
    private double score;
    private String title;
    private String author;
    private String matchedView;
    private Map<String, Object> metadata;
  }

  public static RecommendationResponse fromResults(RankedResults results) {
    return RecommendationResponse.builder()
        .query(results.query())
        .strategy(results.strategy().getValue())
        .totalResults(results.results().size())
        .degraded(results.degraded())
        .droppedViews(results.droppedViews().stream().map(SummaryView::getValue).toList())
        .recommendations(results.results().stream().map(RecommendationResponse::toItem).toList())
        .build();
  }

  private static Item toItem(Recommendation recommendation) {
    return Item.builder()
        .id(recommendation.id())
        .score(recommendation.score())
        .title(recommendation.title())
        .author(recommendation.author())
        .matchedView(recommendation.matchedView().getValue())
        .metadata(recommendation.metadata())
        .build();
  }
}
