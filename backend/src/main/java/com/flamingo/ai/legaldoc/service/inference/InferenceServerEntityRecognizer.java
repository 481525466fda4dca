package com.flamingo.ai.legaldoc.service.inference;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link EntityRecognizer} backed by the model server's NER endpoint. */
@Component
@RequiredArgsConstructor
@Slf4j
public class InferenceServerEntityRecognizer implements EntityRecognizer {

  static final String COLLABORATOR = "entity recognition";
  static final String CIRCUIT_BREAKER = "inference-ner";

  private final InferenceServerClient client;

  @Override
  @Timed(value = "inference.ner", description = "Time to annotate named entities")
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "annotateFallback")
  public List<RecognizedSpan> annotate(String text) {
    List<InferenceServerClient.NerEntity> entities;
    try {
      entities = client.recognizeEntities(text);
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          COLLABORATOR, "NER request failed: " + e.getMessage(), e);
    }
    if (entities == null) {
      throw new CollaboratorUnavailableException(COLLABORATOR, "NER returned no response");
    }
    log.debug("NER returned {} entities for {} chars", entities.size(), text.length());
    return entities.stream().map(e -> new RecognizedSpan(e.label(), e.text())).toList();
  }

  private List<RecognizedSpan> annotateFallback(String text, Throwable t) {
    throw InferenceFailures.unavailable(COLLABORATOR, t);
  }
}
