package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.domain.SourceDocument;
import com.flamingo.ai.bookviews.storage.BlobStore;
import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads raw books from blob storage.
 *
 * <p>Keys follow the upload layout {@code <prefix>/<Title>__by__<Author>.txt}; the author part is
 * optional and falls back to the author named in the text. The document id joins the slugs of
 * every path segment with {@code .}, so re-uploading a book under the same key keeps its index
 * record while equal file names in different corpora stay distinct.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceDocumentLoader {

  private static final String AUTHOR_SEPARATOR = "__by__";
  private static final String ID_SEPARATOR = ".";

  private final BlobStore blobStore;
  private final GutenbergTextCleaner cleaner;

  public SourceDocument load(String key) throws IOException {
    byte[] raw = blobStore.get(key);
    String checksum = Hashing.sha256().hashBytes(raw).toString();
    String content = cleaner.clean(new String(raw, StandardCharsets.UTF_8));

    String baseName = baseName(key);
    String title = baseName;
    String author = null;
    int separator = baseName.indexOf(AUTHOR_SEPARATOR);
    if (separator > 0) {
      title = baseName.substring(0, separator);
      author = baseName.substring(separator + AUTHOR_SEPARATOR.length()).replace('-', ' ').strip();
    }
    title = title.replace('-', ' ').strip();
    if (author == null || author.isEmpty()) {
      author = cleaner.extractAuthor(content);
    }

    log.debug("Loaded {} ({} raw bytes, {} cleaned chars)", key, raw.length, content.length());
    return new SourceDocument(idForKey(key), title, author, content, checksum, key);
  }

  public static String idForKey(String key) {
    String path = key.substring(0, key.length() - fileName(key).length()) + baseName(key);
    return slugSegments(path);
  }

  /**
   * Prefix shared by the ids of every document under {@code corpus}, or {@code ""} for the whole
   * store.
   */
  public static String idPrefixForCorpus(String corpus) {
    String segments = slugSegments(corpus);
    return segments.isEmpty() ? "" : segments + ID_SEPARATOR;
  }

  private static String slugSegments(String path) {
    return Splitter.on('/')
        .omitEmptyStrings()
        .trimResults()
        .splitToStream(path)
        .map(GutenbergTextCleaner::slugify)
        .collect(Collectors.joining(ID_SEPARATOR));
  }

  private static String fileName(String key) {
    return key.substring(key.lastIndexOf('/') + 1);
  }

  private static String baseName(String key) {
    String name = fileName(key);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
