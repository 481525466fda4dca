package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.service.inference.SummarizationModel;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces the abstractive summary.
 *
 * <p>Only the first {@code maxInputTokens} whitespace tokens are sent; the model server truncates
 * again at its own token boundaries, so text past that point never affects the summary.
 */
@Slf4j
public class Summarizer {

  private final SummarizationModel summarizationModel;
  private final SummarizationModel.GenerationSettings settings;
  private final int maxInputTokens;

  public Summarizer(
      SummarizationModel summarizationModel,
      SummarizationModel.GenerationSettings settings,
      int maxInputTokens) {
    this.summarizationModel = summarizationModel;
    this.settings = settings;
    this.maxInputTokens = maxInputTokens;
  }

  /**
   * Summarizes normalized text.
   *
   * @throws CollaboratorUnavailableException if the summarization model fails
   */
  public String summarize(String text) {
    String input = truncate(text);
    try {
      return summarizationModel.summarize(input, settings);
    } catch (CollaboratorUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          "summarization", "Summarization failed: " + e.getMessage(), e);
    }
  }

  public SummarizationModel.GenerationSettings settings() {
    return settings;
  }

  String truncate(String text) {
    String[] tokens = text.split(" ");
    if (tokens.length <= maxInputTokens) {
      return text;
    }
    log.debug("Summary input truncated from {} to {} tokens", tokens.length, maxInputTokens);
    return String.join(" ", Arrays.copyOf(tokens, maxInputTokens));
  }
}
