package com.flamingo.ai.bookviews.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Semantic lens under which a book is summarized and embedded independently.
 *
 * <p>Each view carries two instructions: the map instruction applied to every chunk of the source
 * text, and the reduce instruction used to condense the concatenated chunk digests into the final
 * view summary.
 */
public enum SummaryView {
  PLOT(
      "plot",
      """
        Extract the plot events of this section in order: what happens, who acts, where and when,
        and how the section moves the story forward. Leave out literary analysis.
        """,
      """
        Write a comprehensive plot summary of the whole book from these section digests: the
        complete arc of major events, the central conflicts and how they resolve, and the setting.
        Aim for 8-12 sentences of plain prose.
        """),
  THEMATIC(
      "thematic",
      """
        Extract the themes, motifs, symbols and ideas present in this section, and any social or
        philosophical commentary. Name them concretely; do not retell the plot.
        """,
      """
        Write a thematic analysis of the whole book from these section digests: primary themes
        and how they develop, symbolism, social or philosophical ideas, and literary style.
        Aim for 6-10 sentences of plain prose.
        """),
  CHARACTER(
      "character",
      """
        Extract the characters who appear in this section: their traits, motivations,
        relationships and any change they undergo. Do not retell events beyond what is needed.
        """,
      """
        Write a character-focused summary of the whole book from these section digests: the main
        characters and their personalities, their relationships and development, and the
        supporting cast. Aim for 6-10 sentences of plain prose.
        """),
  COMBINED(
      "combined",
      """
        Summarize this section so that a reader understands its events, the people involved and
        what it means for the book as a whole.
        """,
      """
        Write an overall description of the whole book from these section digests that covers its
        story, its main characters and its central themes, suitable for recommending the book to
        a reader. Aim for 8-12 sentences of plain prose.
        """);

  private final String value;
  private final String mapInstruction;
  private final String reduceInstruction;

  SummaryView(String value, String mapInstruction, String reduceInstruction) {
    this.value = value;
    this.mapInstruction = mapInstruction;
    this.reduceInstruction = reduceInstruction;
  }

  public String getValue() {
    return value;
  }

  public String getMapInstruction() {
    return mapInstruction;
  }

  public String getReduceInstruction() {
    return reduceInstruction;
  }

  /** Name of the index field holding this view's summary text. */
  public String summaryField() {
    return value + "Summary";
  }

  /** Name of the index field holding this view's embedding. */
  public String embeddingField() {
    return value + "Embedding";
  }

  public static SummaryView fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(view -> view.value.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown summary view: " + value));
  }
}
