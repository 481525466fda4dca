package com.flamingo.ai.legaldoc.service.inference;

/** Extractive question answering over a context passage. */
public interface QuestionAnsweringModel {

  /**
   * Finds the span of {@code context} that best answers {@code question}.
   *
   * @throws com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException if the model
   *     cannot be reached
   */
  Answer answer(String question, String context);

  /**
   * An answer span and its score.
   *
   * @param text the answer span
   * @param score confidence in [0, 1]
   */
  record Answer(String text, double score) {}
}
