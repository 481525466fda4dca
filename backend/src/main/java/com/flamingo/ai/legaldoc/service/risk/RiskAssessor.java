package com.flamingo.ai.legaldoc.service.risk;

import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
import com.flamingo.ai.legaldoc.service.analysis.ClauseQuestionSet;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.EntityCategory;
import com.flamingo.ai.legaldoc.service.analysis.model.ExtractedEntitySet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rule-based risk scoring over a finished analysis. Deterministic: the same result always yields
 * the same profile.
 */
@Component
@Slf4j
public class RiskAssessor {

  static final double POINTS_PER_AMOUNT = 20.0;
  static final double MISSING_DATE_POINTS = 50.0;
  static final double MISSING_JURISDICTION_POINTS = 50.0;
  static final double WORDS_FOR_FULL_COMPLEXITY = 5000.0;
  static final double LOW_CONFIDENCE = 0.5;

  public RiskProfile assess(AnalysisResult result) {
    List<String> factors = new ArrayList<>();
    ExtractedEntitySet entities = result.entities();

    Set<String> amounts = new LinkedHashSet<>(entities.get(EntityCategory.MONEY));
    amounts.addAll(entities.get(EntityCategory.MONETARY_AMOUNTS));
    double financial = cap(amounts.size() * POINTS_PER_AMOUNT);
    if (!amounts.isEmpty()) {
      factors.add(amounts.size() + " distinct monetary amount(s) referenced");
    }

    List<String> expected = ClauseQuestionSet.forType(result.documentType()).questions();
    List<String> missing =
        expected.stream()
            .filter(
                question ->
                    result.keyClauses().values().stream()
                        .noneMatch(clause -> question.equals(clause.question())))
            .toList();
    double legal = cap(100.0 * missing.size() / expected.size());
    for (String question : missing) {
      factors.add("No answer found for: " + question);
    }

    double confidence = result.documentInfo().confidence();
    double operational = cap(100.0 * (1.0 - confidence));
    if (confidence < LOW_CONFIDENCE) {
      factors.add("Document type is uncertain (confidence " + round(confidence) + ")");
    }

    double compliance = 0.0;
    if (entities.get(EntityCategory.DATE).isEmpty()) {
      compliance += MISSING_DATE_POINTS;
      factors.add("No dates identified");
    }
    if (entities.get(EntityCategory.GPE).isEmpty()) {
      compliance += MISSING_JURISDICTION_POINTS;
      factors.add("No jurisdiction identified");
    }

    double overall = round((financial + legal + operational + compliance) / 4.0);
    double complexity =
        cap(100.0 * result.documentInfo().wordCount() / WORDS_FOR_FULL_COMPLEXITY);

    RiskProfile profile =
        new RiskProfile(
            round(financial),
            round(legal),
            round(operational),
            round(compliance),
            overall,
            RiskLevel.fromScore(overall),
            factors,
            round(complexity));
    log.debug("Risk assessed: overall={}, level={}", overall, profile.level());
    return profile;
  }

  private static double cap(double score) {
    return Math.max(0.0, Math.min(100.0, score));
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
