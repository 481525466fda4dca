package com.flamingo.ai.legaldoc.service.inference;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** {@link SummarizationModel} backed by the seq2seq model on the model server. */
@Component
@ConditionalOnProperty(
    name = "legal.inference.summarization-strategy",
    havingValue = "server",
    matchIfMissing = true)
@RequiredArgsConstructor
public class InferenceServerSummarizer implements SummarizationModel {

  static final String COLLABORATOR = "summarization";
  static final String CIRCUIT_BREAKER = "inference-summarization";

  private final InferenceServerClient client;

  @Override
  @Timed(value = "inference.summarize", description = "Time to generate a summary")
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "summarizeFallback")
  public String summarize(String text, GenerationSettings settings) {
    InferenceServerClient.SummarizeResponse response;
    try {
      response = client.summarize(text, settings);
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          COLLABORATOR, "Summarization request failed: " + e.getMessage(), e);
    }
    if (response == null || response.summaryText() == null) {
      throw new CollaboratorUnavailableException(COLLABORATOR, "Summarization returned no text");
    }
    return response.summaryText().trim();
  }

  private String summarizeFallback(String text, GenerationSettings settings, Throwable t) {
    throw InferenceFailures.unavailable(COLLABORATOR, t);
  }
}
