package com.flamingo.ai.bookviews.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a book recommendation query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must be at most 2000 characters")
  private String query;

  /** One of plot, thematic, character, combined or multi. Defaults to multi. */
  private String strategy;

  @Positive(message = "Size must be positive")
  private Integer size;

  private String corpus;
}
