package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.service.analysis.model.EntityCategory;
import com.flamingo.ai.legaldoc.service.analysis.model.ExtractedEntitySet;
import com.flamingo.ai.legaldoc.service.inference.EntityRecognizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts entities by merging recognizer output with a dollar-amount pattern.
 *
 * <p>Recognizer spans are kept only for PERSON, ORG, DATE, MONEY and GPE, once per (category,
 * text). Dollar amounts go to {@link EntityCategory#MONETARY_AMOUNTS} on their own, every match
 * kept, and are not reconciled with the recognizer's MONEY spans.
 */
@Slf4j
public class EntityExtractor {

  static final Pattern MONETARY_AMOUNT = Pattern.compile("\\$[\\d,]+(?:\\.\\d{2})?");

  private final EntityRecognizer entityRecognizer;

  public EntityExtractor(EntityRecognizer entityRecognizer) {
    this.entityRecognizer = entityRecognizer;
  }

  /**
   * Extracts entities from normalized text.
   *
   * @throws CollaboratorUnavailableException if the recognizer fails
   */
  public ExtractedEntitySet extract(String text) {
    List<EntityRecognizer.RecognizedSpan> spans = annotate(text);

    Map<EntityCategory, Set<String>> distinct = new EnumMap<>(EntityCategory.class);
    int discarded = 0;
    for (EntityRecognizer.RecognizedSpan span : spans) {
      Optional<EntityCategory> category = EntityCategory.fromRecognizerLabel(span.label());
      if (category.isEmpty() || span.text() == null) {
        discarded++;
        continue;
      }
      distinct.computeIfAbsent(category.get(), c -> new LinkedHashSet<>()).add(span.text());
    }

    Map<EntityCategory, List<String>> result = new EnumMap<>(EntityCategory.class);
    distinct.forEach((category, values) -> result.put(category, new ArrayList<>(values)));
    result.put(EntityCategory.MONETARY_AMOUNTS, findMonetaryAmounts(text));

    ExtractedEntitySet entities = new ExtractedEntitySet(result);
    log.debug(
        "Extracted {} entities ({} recognizer spans, {} discarded)",
        entities.size(),
        spans.size(),
        discarded);
    return entities;
  }

  private List<EntityRecognizer.RecognizedSpan> annotate(String text) {
    try {
      return entityRecognizer.annotate(text);
    } catch (CollaboratorUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException(
          "entity recognition", "Entity recognition failed: " + e.getMessage(), e);
    }
  }

  static List<String> findMonetaryAmounts(String text) {
    List<String> amounts = new ArrayList<>();
    Matcher matcher = MONETARY_AMOUNT.matcher(text);
    while (matcher.find()) {
      amounts.add(matcher.group());
    }
    return amounts;
  }
}
