package com.flamingo.ai.bookviews.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Finished summaries for one document, one per configured view. A bundle can only be built
 * complete: every view must carry a non-blank summary.
 *
 * @param documentId source document id
 * @param summaries view to summary text
 * @param excerpt short verbatim excerpt of the source, not embedded
 * @param totalChunks number of first-level chunks the source was split into
 */
public record SummaryBundle(
    String documentId, Map<SummaryView, String> summaries, String excerpt, int totalChunks) {

  public SummaryBundle {
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(summaries, "summaries");
    for (SummaryView view : SummaryView.values()) {
      String summary = summaries.get(view);
      if (summary == null || summary.isBlank()) {
        throw new IllegalArgumentException(
            "Summary bundle for " + documentId + " is missing view " + view.getValue());
      }
    }
    summaries = Collections.unmodifiableMap(new EnumMap<>(summaries));
    excerpt = excerpt == null ? "" : excerpt;
  }

  public String summary(SummaryView view) {
    return summaries.get(view);
  }
}
