package com.flamingo.ai.legaldoc.service.inference;

import com.flamingo.ai.legaldoc.agent.LegalSummaryAgent;
import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link SummarizationModel} backed by a chat LLM through {@link LegalSummaryAgent}.
 *
 * <p>Beam settings have no meaning for a chat model; only the length bounds are passed on, as a
 * word range.
 */
@Component
@ConditionalOnProperty(name = "legal.inference.summarization-strategy", havingValue = "llm")
@RequiredArgsConstructor
@Slf4j
public class LlmSummarizer implements SummarizationModel {

  static final String COLLABORATOR = "summarization";

  private final LegalSummaryAgent legalSummaryAgent;

  @Override
  @Timed(value = "inference.summarize.llm", description = "Time to generate an LLM summary")
  public String summarize(String text, GenerationSettings settings) {
    String summary;
    try {
      summary = legalSummaryAgent.summarize(text, settings.minLength(), settings.maxLength());
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          COLLABORATOR, "LLM summarization failed: " + e.getMessage(), e);
    }
    if (summary == null) {
      throw new CollaboratorUnavailableException(COLLABORATOR, "LLM returned no summary");
    }
    log.debug("LLM summary generated: {} chars", summary.length());
    return summary.trim();
  }
}
