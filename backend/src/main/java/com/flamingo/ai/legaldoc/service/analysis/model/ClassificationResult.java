package com.flamingo.ai.legaldoc.service.analysis.model;

import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of keyword classification.
 *
 * @param predictedType the highest scoring type, first-declared on ties
 * @param confidence the predicted type's score
 * @param scores every taxonomy type's score in [0, 1], in taxonomy order
 */
public record ClassificationResult(
    DocumentType predictedType, double confidence, Map<DocumentType, Double> scores) {

  public ClassificationResult {
    scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
  }
}
