package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.service.analysis.model.ClassificationResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based document type classifier.
 *
 * <p>Each taxonomy type scores the fraction of its indicator keywords that occur in the text as
 * case-insensitive substrings. Presence counts, frequency does not. The highest score wins; ties go
 * to the type declared first in {@link DocumentType}.
 */
public class DocumentClassifier {

  public ClassificationResult classify(String text) {
    String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

    Map<DocumentType, Double> scores = new LinkedHashMap<>();
    DocumentType best = null;
    double bestScore = -1.0;

    for (DocumentType type : DocumentType.taxonomy()) {
      double score = score(lower, type.indicators());
      scores.put(type, score);
      // strict comparison keeps the earlier type on ties
      if (score > bestScore) {
        best = type;
        bestScore = score;
      }
    }

    return new ClassificationResult(best, bestScore, scores);
  }

  private double score(String lowerText, List<String> indicators) {
    long present = indicators.stream().filter(lowerText::contains).count();
    return (double) present / indicators.size();
  }
}
