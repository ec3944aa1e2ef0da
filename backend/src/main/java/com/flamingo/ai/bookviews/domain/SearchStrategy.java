package com.flamingo.ai.bookviews.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Closed set of recommendation strategies. Single-view strategies search one embedding space. */
public enum SearchStrategy {
  PLOT("plot", List.of(SummaryView.PLOT)),
  THEMATIC("thematic", List.of(SummaryView.THEMATIC)),
  CHARACTER("character", List.of(SummaryView.CHARACTER)),
  COMBINED("combined", List.of(SummaryView.COMBINED)),
  MULTI("multi", List.of(SummaryView.values()));

  private final String value;
  private final List<SummaryView> views;

  SearchStrategy(String value, List<SummaryView> views) {
    this.value = value;
    this.views = views;
  }

  public String getValue() {
    return value;
  }

  public List<SummaryView> getViews() {
    return views;
  }

  public boolean isMultiView() {
    return views.size() > 1;
  }

  public static SearchStrategy fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(strategy -> strategy.value.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown search strategy: " + value));
  }
}
