package com.flamingo.ai.bookviews.domain;

import java.util.Objects;

/**
 * A raw book fetched from blob storage. Immutable once loaded.
 *
 * @param id stable external identifier, also the index key
 * @param title book title
 * @param author book author, or {@code Unknown Author}
 * @param content cleaned full text
 * @param contentChecksum SHA-256 of the raw bytes
 * @param sourceKey blob key the content was read from
 */
public record SourceDocument(
    String id, String title, String author, String content, String contentChecksum, String sourceKey) {

  public SourceDocument {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(content, "content");
  }

  public int length() {
    return content.length();
  }
}
