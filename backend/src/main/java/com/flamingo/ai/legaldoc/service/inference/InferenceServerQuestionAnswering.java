package com.flamingo.ai.legaldoc.service.inference;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** {@link QuestionAnsweringModel} backed by the model server's QA endpoint. */
@Component
@RequiredArgsConstructor
public class InferenceServerQuestionAnswering implements QuestionAnsweringModel {

  static final String COLLABORATOR = "question answering";
  static final String CIRCUIT_BREAKER = "inference-qa";

  private final InferenceServerClient client;

  @Override
  @Timed(value = "inference.qa", description = "Time to answer one clause question")
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "answerFallback")
  public Answer answer(String question, String context) {
    InferenceServerClient.QaResponse response;
    try {
      response = client.answer(question, context);
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          COLLABORATOR, "QA request failed: " + e.getMessage(), e);
    }
    if (response == null || response.answer() == null) {
      throw new CollaboratorUnavailableException(COLLABORATOR, "QA returned no answer");
    }
    return new Answer(response.answer(), response.score());
  }

  private Answer answerFallback(String question, String context, Throwable t) {
    throw InferenceFailures.unavailable(COLLABORATOR, t);
  }
}
