package com.flamingo.ai.bookviews.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileSystemBlobStore Tests")
class FileSystemBlobStoreTest {

  @TempDir Path root;

  private FileSystemBlobStore store;

  @BeforeEach
  void setUp() {
    store = new FileSystemBlobStore(root);
  }

  @Test
  @DisplayName("should read back what was written")
  void shouldReadAfterWrite() throws Exception {
    store.put("books/Emma.txt", "Emma Woodhouse".getBytes(StandardCharsets.UTF_8));
    store.put("books/Emma.txt", "Emma Woodhouse, handsome".getBytes(StandardCharsets.UTF_8));

    assertThat(new String(store.get("books/Emma.txt"), StandardCharsets.UTF_8))
        .isEqualTo("Emma Woodhouse, handsome");
  }

  @Test
  @DisplayName("should list keys under a prefix in sorted order")
  void shouldListSortedKeys() throws Exception {
    store.put("books/b.txt", new byte[] {1});
    store.put("books/a.txt", new byte[] {1});
    store.put("books/nested/c.txt", new byte[] {1});
    store.put("other/d.txt", new byte[] {1});

    assertThat(store.list("books/"))
        .containsExactly("books/a.txt", "books/b.txt", "books/nested/c.txt");
  }

  @Test
  @DisplayName("should report a missing key as NoSuchFileException")
  void shouldFail_whenKeyMissing() {
    assertThatThrownBy(() -> store.get("books/none.txt")).isInstanceOf(NoSuchFileException.class);
  }

  @Test
  @DisplayName("should refuse keys that escape the root")
  void shouldRejectEscapingKey() {
    assertThatThrownBy(() -> store.put("../outside.txt", new byte[] {1}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
