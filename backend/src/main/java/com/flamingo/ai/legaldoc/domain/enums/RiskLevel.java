package com.flamingo.ai.legaldoc.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Risk bands for an overall risk score in [0, 100]. */
public enum RiskLevel {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  CRITICAL("critical");

  private final String value;

  RiskLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static RiskLevel fromScore(double score) {
    if (score < 25) {
      return LOW;
    }
    if (score < 50) {
      return MEDIUM;
    }
    if (score < 75) {
      return HIGH;
    }
    return CRITICAL;
  }
}
