package com.flamingo.ai.bookviews.storage;

import java.io.IOException;
import java.util.List;

/**
 * Key/bytes storage for raw source documents and summary artifacts.
 *
 * <p>Put-then-get of the same key within one process must observe the put.
 */
public interface BlobStore {

  /**
   * Reads a blob.
   *
   * @throws java.nio.file.NoSuchFileException when the key does not exist
   */
  byte[] get(String key) throws IOException;

  void put(String key, byte[] content) throws IOException;

  /** Keys under {@code prefix}, sorted lexicographically. */
  List<String> list(String prefix) throws IOException;
}
