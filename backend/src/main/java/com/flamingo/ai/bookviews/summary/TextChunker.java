package com.flamingo.ai.bookviews.summary;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping character windows.
 *
 * <p>Each chunk nominally ends at {@code start + chunkSize}. If a sentence terminal occurs at or
 * within {@code lookahead} characters past that point, the chunk is extended to include it;
 * otherwise it is cut hard. The next chunk starts exactly {@code overlap} characters before the
 * previous end, so neighbours always share {@code overlap} characters. For text without sentence
 * terminals the chunk count is {@code ceil((length - overlap) / (chunkSize - overlap))}.
 */
@Component
public class TextChunker {

  public List<String> split(String text, int chunkSize, int overlap, int lookahead) {
    if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Invalid chunking: size=" + chunkSize + ", overlap=" + overlap);
    }
    int length = text.length();
    List<String> chunks = new ArrayList<>();
    if (length <= chunkSize) {
      chunks.add(text);
      return chunks;
    }

    int start = 0;
    while (true) {
      int nominalEnd = start + chunkSize;
      if (nominalEnd >= length) {
        chunks.add(text.substring(start));
        return chunks;
      }
      int end = extendToSentenceEnd(text, nominalEnd, lookahead);
      if (end >= length) {
        chunks.add(text.substring(start));
        return chunks;
      }
      chunks.add(text.substring(start, end));
      start = end - overlap;
    }
  }

  /**
   * Shortens {@code text} to at most {@code maxLength} characters, preferring to end on a sentence
   * terminal. Falls back to a hard cut when the last terminal leaves less than half the budget.
   */
  public String truncateAtSentence(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    for (int i = maxLength - 1; i >= maxLength / 2; i--) {
      if (isSentenceTerminal(text.charAt(i))) {
        return text.substring(0, i + 1).strip();
      }
    }
    return text.substring(0, maxLength).strip();
  }

  private static int extendToSentenceEnd(String text, int nominalEnd, int lookahead) {
    int limit = Math.min(text.length(), nominalEnd + lookahead);
    for (int i = nominalEnd - 1; i < limit; i++) {
      if (isSentenceTerminal(text.charAt(i))) {
        return i + 1;
      }
    }
    return nominalEnd;
  }

  static boolean isSentenceTerminal(char c) {
    return c == '.' || c == '!' || c == '?';
  }
}
