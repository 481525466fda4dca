package com.flamingo.ai.legaldoc.service.inference;

import java.util.List;

/** Named-entity recognizer producing labelled spans in document order. */
public interface EntityRecognizer {

  /**
   * Annotates text with named entities.
   *
   * @param text the text to annotate
   * @return recognized spans in order of appearance
   * @throws com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException if the recognizer
   *     cannot be reached
   */
  List<RecognizedSpan> annotate(String text);

  /** A labelled span, e.g. ("ORG", "Tech Innovations Inc."). */
  record RecognizedSpan(String label, String text) {}
}
