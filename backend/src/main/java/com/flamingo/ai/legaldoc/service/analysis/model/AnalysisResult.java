package com.flamingo.ai.legaldoc.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The complete, immutable result of analyzing one document.
 *
 * @param documentInfo type, confidence, word count and processing time
 * @param entities extracted entity spans
 * @param keyClauses kept clauses by key, in question order
 * @param summary abstractive summary
 * @param classificationScores every taxonomy type's score
 */
public record AnalysisResult(
    @JsonProperty("document_info") DocumentInfo documentInfo,
    @JsonProperty("entities") ExtractedEntitySet entities,
    @JsonProperty("key_clauses") Map<String, KeyClause> keyClauses,
    @JsonProperty("summary") String summary,
    @JsonIgnore Map<DocumentType, Double> classificationScores) {

  public AnalysisResult {
    keyClauses = Collections.unmodifiableMap(new LinkedHashMap<>(keyClauses));
    classificationScores = Collections.unmodifiableMap(new LinkedHashMap<>(classificationScores));
  }

  public DocumentType documentType() {
    return documentInfo.type();
  }

  @JsonProperty("classification_scores")
  public Map<String, Double> classificationScoresByValue() {
    Map<String, Double> json = new LinkedHashMap<>();
    classificationScores.forEach((type, score) -> json.put(type.value(), score));
    return json;
  }
}
