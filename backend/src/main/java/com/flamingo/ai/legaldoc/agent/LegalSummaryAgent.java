package com.flamingo.ai.legaldoc.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent producing a short abstractive summary of a legal document. */
public interface LegalSummaryAgent {

  @SystemMessage(
      """
        You summarize legal documents for non-lawyers. Write one plain-text paragraph of
        between {{minWords}} and {{maxWords}} words that states what kind of document it is, who
        the parties are, and the most important obligations, amounts and dates. Do not use
        markdown, bullet points or headings. Do not add facts that are not in the document.
        """)
  @UserMessage("""
        Document:
        {{content}}
        """)
  String summarize(
      @V("content") String content, @V("minWords") int minWords, @V("maxWords") int maxWords);
}
