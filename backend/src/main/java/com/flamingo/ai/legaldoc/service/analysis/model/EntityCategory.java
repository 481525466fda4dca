package com.flamingo.ai.legaldoc.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Entity categories kept in an analysis, in output order. */
public enum EntityCategory {
  PERSON("PERSON", "legal_entity"),
  ORG("ORG", "legal_entity"),
  DATE("DATE", "temporal"),
  MONEY("MONEY", "financial"),
  GPE("GPE", "location"),

  /** Regex matches of dollar amounts, kept apart from the recognizer's MONEY spans. */
  MONETARY_AMOUNTS("monetary_amounts", "financial");

  private final String key;
  private final String group;

  EntityCategory(String key, String group) {
    this.key = key;
    this.group = group;
  }

  @JsonValue
  public String key() {
    return key;
  }

  /** Coarse grouping stored alongside each persisted entity. */
  public String group() {
    return group;
  }

  public boolean isRecognizerLabel() {
    return this != MONETARY_AMOUNTS;
  }

  /** Maps a recognizer label to a kept category; other labels are not kept. */
  public static Optional<EntityCategory> fromRecognizerLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    for (EntityCategory category : values()) {
      if (category.isRecognizerLabel() && category.key.equals(label)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }

  public static Optional<EntityCategory> fromKey(String key) {
    for (EntityCategory category : values()) {
      if (category.key.equals(key)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
