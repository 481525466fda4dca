package com.flamingo.ai.legaldoc.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * Legal document types.
 *
 * <p>Declaration order matters: the classifier scores the types that carry indicator keywords in
 * this order, and the first-declared type wins a tie.
 */
public enum DocumentType {
  CONTRACT("contract", List.of("agreement", "party", "whereas", "covenant")),
  LICENSE("license", List.of("license", "licensor", "licensee", "grant")),
  LEASE("lease", List.of("lease", "lessor", "lessee", "rent", "premises")),
  EMPLOYMENT("employment", List.of("employee", "employer", "employment", "salary")),
  NDA("nda", List.of("confidential", "non-disclosure", "proprietary")),

  // Stored types the keyword classifier never predicts.
  TERMS_OF_SERVICE("terms_of_service", List.of()),
  PRIVACY_POLICY("privacy_policy", List.of()),
  OTHER("other", List.of());

  private static final List<DocumentType> TAXONOMY =
      Arrays.stream(values()).filter(DocumentType::isClassifiable).toList();

  private final String value;
  private final List<String> indicators;

  DocumentType(String value, List<String> indicators) {
    this.value = value;
    this.indicators = indicators;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Lower-case keywords whose presence signals this type. */
  public List<String> indicators() {
    return indicators;
  }

  public boolean isClassifiable() {
    return !indicators.isEmpty();
  }

  /** Types scored by the classifier, in declaration order. */
  public static List<DocumentType> taxonomy() {
    return TAXONOMY;
  }

  @Override
  public String toString() {
    return value;
  }
}
