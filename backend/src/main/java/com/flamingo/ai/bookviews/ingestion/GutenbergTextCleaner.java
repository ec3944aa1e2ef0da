package com.flamingo.ai.bookviews.ingestion;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Strips Project Gutenberg boilerplate and noise from raw book text, and guesses the author. */
@Component
public class GutenbergTextCleaner {

  static final String UNKNOWN_AUTHOR = "Unknown Author";

  private static final List<String> START_MARKERS =
      List.of(
          "*** START OF THE PROJECT GUTENBERG EBOOK",
          "*** START OF THIS PROJECT GUTENBERG EBOOK",
          "The Project Gutenberg eBook of");

  private static final List<String> END_MARKERS =
      List.of("*** END OF THE PROJECT GUTENBERG EBOOK", "*** END OF THIS PROJECT GUTENBERG EBOOK");

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
  private static final Pattern NOISE =
      Pattern.compile("[^\\p{L}\\p{N}_\\s.,!?;:()'\"-]", Pattern.UNICODE_CHARACTER_CLASS);

  /** Capitalized words on one line; the keyword before it is matched case-insensitively. */
  private static final String NAME = "([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)*)";

  private static final List<Pattern> AUTHOR_PATTERNS =
      List.of(
          Pattern.compile("\\b(?i:author):[ \\t]*" + NAME),
          Pattern.compile("\\b(?i:written by)[ \\t]+" + NAME),
          Pattern.compile("\\b(?i:by)[ \\t]+" + NAME));

  private static final int AUTHOR_SCAN_LENGTH = 2000;

  public String clean(String raw) {
    String text = raw;
    for (String marker : START_MARKERS) {
      int at = text.indexOf(marker);
      if (at >= 0) {
        text = text.substring(at + marker.length());
        break;
      }
    }
    for (String marker : END_MARKERS) {
      int at = text.indexOf(marker);
      if (at >= 0) {
        text = text.substring(0, at);
        break;
      }
    }
    text = text.replace("\r\n", "\n");
    text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
    text = NOISE.matcher(text).replaceAll("");
    return text.strip();
  }

  /** Author named near the start of the text, or {@value #UNKNOWN_AUTHOR}. */
  public String extractAuthor(String text) {
    String head = text.substring(0, Math.min(text.length(), AUTHOR_SCAN_LENGTH));
    for (Pattern pattern : AUTHOR_PATTERNS) {
      Matcher matcher = pattern.matcher(head);
      if (matcher.find()) {
        return matcher.group(1).strip();
      }
    }
    return UNKNOWN_AUTHOR;
  }

  /** Lower-case, dash-separated form of a title, safe for keys and ids. */
  public static String slugify(String value) {
    String slug =
        value
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}\\s_-]", "")
            .strip()
            .replaceAll("[-\\s_]+", "-");
    return slug.isEmpty() ? "untitled" : slug;
  }
}
