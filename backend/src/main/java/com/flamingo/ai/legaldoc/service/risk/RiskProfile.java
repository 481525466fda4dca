package com.flamingo.ai.legaldoc.service.risk;

import com.flamingo.ai.legaldoc.domain.enums.RiskLevel;
import java.util.List;

/**
 * Risk scores derived from one analysis. Every score is in [0, 100].
 *
 * @param financialRisk grows with the number of distinct amounts referenced
 * @param legalRisk share of expected clauses that were not found
 * @param operationalRisk uncertainty of the classification
 * @param complianceRisk missing dates and jurisdictions
 * @param overallRisk mean of the four scores above
 * @param level band of the overall score
 * @param riskFactors human readable reasons, in the order the scores are computed
 * @param complexityScore document length relative to a long contract
 */
public record RiskProfile(
    double financialRisk,
    double legalRisk,
    double operationalRisk,
    double complianceRisk,
    double overallRisk,
    RiskLevel level,
    List<String> riskFactors,
    double complexityScore) {

  public RiskProfile {
    riskFactors = List.copyOf(riskFactors);
  }
}
