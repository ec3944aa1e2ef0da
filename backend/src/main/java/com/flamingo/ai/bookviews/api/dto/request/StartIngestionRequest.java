package com.flamingo.ai.bookviews.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting an ingestion run. An empty prefix uses the configured corpus. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartIngestionRequest {

  private String corpusPrefix;
}
