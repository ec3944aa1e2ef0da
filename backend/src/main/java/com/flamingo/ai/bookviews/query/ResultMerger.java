package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.indexing.VectorHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges per-view hit lists into one ranking.
 *
 * <p>A book's score is the best score it reached in any view (max-pooling), and the view that
 * produced it is reported as the match. Equal scores are ordered by how many distinct query terms
 * appear in the book's combined summary, then by id.
 */
final class ResultMerger {

  private static final Pattern TERM = Pattern.compile("[\\p{L}\\p{N}]+");

  private ResultMerger() {}

  static List<Recommendation> merge(
      Map<SummaryView, List<VectorHit>> hitsByView, String query, int size) {
    Map<String, Candidate> best = new LinkedHashMap<>();
    hitsByView.forEach(
        (view, hits) -> {
          for (VectorHit hit : hits) {
            Candidate existing = best.get(hit.id());
            if (existing == null || hit.score() > existing.hit.score()) {
              best.put(hit.id(), new Candidate(hit, view));
            }
          }
        });

    Set<String> queryTerms = terms(query);
    List<Candidate> candidates = new ArrayList<>(best.values());
    for (Candidate candidate : candidates) {
      candidate.overlap = overlap(queryTerms, candidate.hit.combinedSummary());
    }
    candidates.sort(
        Comparator.comparingDouble((Candidate c) -> c.hit.score())
            .reversed()
            .thenComparing(Comparator.comparingInt((Candidate c) -> c.overlap).reversed())
            .thenComparing(c -> c.hit.id()));

    List<Recommendation> ranked = new ArrayList<>(Math.min(size, candidates.size()));
    for (Candidate candidate : candidates.subList(0, Math.min(size, candidates.size()))) {
      VectorHit hit = candidate.hit;
      ranked.add(
          new Recommendation(
              hit.id(), hit.score(), hit.title(), hit.author(), hit.metadata(), candidate.view));
    }
    return ranked;
  }

  static Set<String> terms(String text) {
    Set<String> terms = new HashSet<>();
    if (text == null) {
      return terms;
    }
    Matcher matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      terms.add(matcher.group());
    }
    return terms;
  }

  static int overlap(Set<String> queryTerms, String summary) {
    if (queryTerms.isEmpty()) {
      return 0;
    }
    Set<String> summaryTerms = terms(summary);
    int count = 0;
    for (String term : queryTerms) {
      if (summaryTerms.contains(term)) {
        count++;
      }
    }
    return count;
  }

  private static final class Candidate {
    private final VectorHit hit;
    private final SummaryView view;
    private int overlap;

    private Candidate(VectorHit hit, SummaryView view) {
      this.hit = hit;
      this.view = view;
    }
  }
}
