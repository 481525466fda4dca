package com.flamingo.ai.legaldoc.service.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity spans per category. Every category is present, possibly with an empty list; each list is
 * in first-occurrence order.
 */
public final class ExtractedEntitySet {

  private final Map<EntityCategory, List<String>> spans;

  public ExtractedEntitySet(Map<EntityCategory, List<String>> spans) {
    EnumMap<EntityCategory, List<String>> copy = new EnumMap<>(EntityCategory.class);
    for (EntityCategory category : EntityCategory.values()) {
      copy.put(category, List.copyOf(spans.getOrDefault(category, List.of())));
    }
    this.spans = Collections.unmodifiableMap(copy);
  }

  public List<String> get(EntityCategory category) {
    return spans.get(category);
  }

  public Map<EntityCategory, List<String>> asMap() {
    return spans;
  }

  /** Total number of spans across all categories. */
  public int size() {
    return spans.values().stream().mapToInt(List::size).sum();
  }

  @JsonValue
  Map<String, List<String>> toJson() {
    Map<String, List<String>> json = new LinkedHashMap<>();
    spans.forEach((category, values) -> json.put(category.key(), values));
    return json;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExtractedEntitySet other && spans.equals(other.spans);
  }

  @Override
  public int hashCode() {
    return spans.hashCode();
  }

  @Override
  public String toString() {
    return "ExtractedEntitySet" + toJson();
  }
}
