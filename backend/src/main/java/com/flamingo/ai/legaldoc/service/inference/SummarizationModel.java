package com.flamingo.ai.legaldoc.service.inference;

/** Abstractive summarizer. */
public interface SummarizationModel {

  /**
   * Summarizes text under the given generation settings.
   *
   * @throws com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException if the model
   *     cannot be reached
   */
  String summarize(String text, GenerationSettings settings);

  /**
   * Decoding constraints for summary generation. Lengths are in model tokens.
   *
   * @param maxLength longest summary allowed
   * @param minLength shortest summary allowed
   * @param numBeams beam search width
   * @param lengthPenalty exponential length penalty applied during beam search
   * @param earlyStopping stop beam search once enough finished candidates exist
   */
  record GenerationSettings(
      int maxLength, int minLength, int numBeams, double lengthPenalty, boolean earlyStopping) {}
}
