package com.flamingo.ai.bookviews.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that condenses a slice of a book under one summary view.
 *
 * <p>The same agent serves the map phase (one chunk of source text), the reduce phase
 * (concatenated digests) and direct summarization of short books; the view-specific instruction
 * decides what is extracted.
 */
public interface ViewSummaryAgent {

  @SystemMessage(
      """
        You are a literary analyst who writes compact, faithful summaries of books.
        Follow the instruction exactly. Write plain prose in complete sentences.
        Do not use markdown, headings or bullet points. Never invent events,
        characters or themes that are not supported by the text.
        """)
  @UserMessage(
      """
        {{instruction}}

        Book: "{{title}}" by {{author}}
        Section {{part}} of {{parts}}:

        {{text}}
        """)
  String summarize(
      @V("instruction") String instruction,
      @V("title") String title,
      @V("author") String author,
      @V("part") int part,
      @V("parts") int parts,
      @V("text") String text);
}
