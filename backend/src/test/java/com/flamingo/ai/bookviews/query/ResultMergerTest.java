package com.flamingo.ai.bookviews.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.indexing.VectorHit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResultMerger Tests")
class ResultMergerTest {

  private static VectorHit hit(String id, double score, String combinedSummary) {
    return new VectorHit(id, score, id, "Author", combinedSummary, Map.of("sourceKey", id));
  }

  @Test
  @DisplayName("should break score ties by query term overlap with the combined summary")
  void shouldBreakTiesByOverlap() {
    Map<SummaryView, List<VectorHit>> hits = new EnumMap<>(SummaryView.class);
    hits.put(
        SummaryView.PLOT,
        List.of(
            hit("a-book", 0.8, "A quiet village romance."),
            hit("b-book", 0.8, "A whale hunt across the open sea.")));

    List<Recommendation> merged = ResultMerger.merge(hits, "Whale at sea", 5);

    assertThat(merged).extracting(Recommendation::id).containsExactly("b-book", "a-book");
  }

  @Test
  @DisplayName("should break remaining ties by id")
  void shouldBreakRemainingTiesById() {
    Map<SummaryView, List<VectorHit>> hits = new EnumMap<>(SummaryView.class);
    hits.put(SummaryView.PLOT, List.of(hit("zeta", 0.5, ""), hit("alpha", 0.5, "")));
    hits.put(SummaryView.THEMATIC, List.of(hit("mid", 0.5, "")));

    List<Recommendation> merged = ResultMerger.merge(hits, "anything", 5);

    assertThat(merged).extracting(Recommendation::id).containsExactly("alpha", "mid", "zeta");
  }

  @Test
  @DisplayName("should keep the first view on an exact score tie between views")
  void shouldKeepFirstView_onCrossViewTie() {
    Map<SummaryView, List<VectorHit>> hits = new EnumMap<>(SummaryView.class);
    hits.put(SummaryView.PLOT, List.of(hit("a", 0.6, "")));
    hits.put(SummaryView.COMBINED, List.of(hit("a", 0.6, "")));

    List<Recommendation> merged = ResultMerger.merge(hits, "q", 5);

    assertThat(merged).singleElement().extracting(Recommendation::matchedView)
        .isEqualTo(SummaryView.PLOT);
  }

  @Test
  @DisplayName("should return at most size results, carrying metadata")
  void shouldCapAtSize() {
    Map<SummaryView, List<VectorHit>> hits = new EnumMap<>(SummaryView.class);
    hits.put(
        SummaryView.COMBINED, List.of(hit("a", 0.9, ""), hit("b", 0.8, ""), hit("c", 0.7, "")));

    List<Recommendation> merged = ResultMerger.merge(hits, "q", 2);

    assertThat(merged).hasSize(2);
    assertThat(merged.get(0).metadata()).containsEntry("sourceKey", "a");
  }

  @Test
  @DisplayName("should count distinct query terms case-insensitively")
  void shouldCountDistinctTerms() {
    int overlap =
        ResultMerger.overlap(ResultMerger.terms("Sea, SEA and ships"), "The sea was full of ships.");

    assertThat(overlap).isEqualTo(2);
  }
}
