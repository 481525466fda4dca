package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.DocumentInfo;
import com.flamingo.ai.legaldoc.service.analysis.model.EntityCategory;
import com.flamingo.ai.legaldoc.service.analysis.model.ExtractedEntitySet;
import com.flamingo.ai.legaldoc.service.analysis.model.KeyClause;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for analysis results used across tests. */
public final class AnalysisFixtures {

  public static final Instant PROCESSED_AT = Instant.parse("2026-01-15T10:00:00Z");

  public static final String CONTRACT_TEXT =
      "This Agreement is entered into by each party. WHEREAS the parties wish to covenant "
          + "as follows. The Buyer shall pay $1,500 on signing and $1,500 on delivery.";

  private AnalysisFixtures() {}

  /** A contract analysis with every contract clause answered and a full set of entities. */
  public static AnalysisResult contractResult() {
    Map<EntityCategory, List<String>> spans = new EnumMap<>(EntityCategory.class);
    spans.put(EntityCategory.ORG, List.of("Acme Corp", "Tech Innovations Inc."));
    spans.put(EntityCategory.DATE, List.of("January 1, 2024"));
    spans.put(EntityCategory.MONEY, List.of("$1,500"));
    spans.put(EntityCategory.GPE, List.of("California"));
    spans.put(EntityCategory.MONETARY_AMOUNTS, List.of("$1,500", "$1,500"));

    Map<String, KeyClause> clauses = new LinkedHashMap<>();
    for (String question : ClauseQuestionSet.CONTRACT.questions()) {
      String key = ClauseExtractor.clauseKey(question);
      clauses.put(key, new KeyClause(key, "answer to " + key, 0.8, question));
    }

    return result(DocumentType.CONTRACT, 1.0, 1000, new ExtractedEntitySet(spans), clauses);
  }

  public static AnalysisResult result(
      DocumentType type,
      double confidence,
      int wordCount,
      ExtractedEntitySet entities,
      Map<String, KeyClause> clauses) {
    Map<DocumentType, Double> scores = new LinkedHashMap<>();
    for (DocumentType taxonomyType : DocumentType.taxonomy()) {
      scores.put(taxonomyType, taxonomyType == type ? confidence : 0.0);
    }
    return new AnalysisResult(
        new DocumentInfo(type, confidence, wordCount, PROCESSED_AT),
        entities,
        clauses,
        "The parties agree to a sale.",
        scores);
  }

  public static ExtractedEntitySet noEntities() {
    return new ExtractedEntitySet(Map.of());
  }
}
