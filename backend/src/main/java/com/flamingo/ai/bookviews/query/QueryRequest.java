package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SearchStrategy;

/**
 * A recommendation query.
 *
 * @param query natural-language description of what the reader wants
 * @param strategy which view or views to search
 * @param size number of books to return
 * @param corpus optional corpus restriction, {@code null} for all
 */
public record QueryRequest(String query, SearchStrategy strategy, int size, String corpus) {

  public QueryRequest(String query, SearchStrategy strategy, int size) {
    this(query, strategy, size, null);
  }
}
