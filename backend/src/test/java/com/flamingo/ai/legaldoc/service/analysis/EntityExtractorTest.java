package com.flamingo.ai.legaldoc.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.service.analysis.model.EntityCategory;
import com.flamingo.ai.legaldoc.service.analysis.model.ExtractedEntitySet;
import com.flamingo.ai.legaldoc.service.inference.EntityRecognizer;
import com.flamingo.ai.legaldoc.service.inference.EntityRecognizer.RecognizedSpan;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntityExtractor Tests")
class EntityExtractorTest {

  @Mock private EntityRecognizer entityRecognizer;

  private EntityExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new EntityExtractor(entityRecognizer);
  }

  @Test
  @DisplayName("Should keep every regex match of a repeated amount")
  void shouldKeepDuplicateMonetaryAmounts() {
    when(entityRecognizer.annotate(anyString())).thenReturn(List.of());

    ExtractedEntitySet entities =
        extractor.extract("Payment of $1,500 is due. Late fee is also $1,500.");

    assertThat(entities.get(EntityCategory.MONETARY_AMOUNTS)).containsExactly("$1,500", "$1,500");
  }

  @Test
  void shouldMatchAmountsWithAndWithoutCents() {
    when(entityRecognizer.annotate(anyString())).thenReturn(List.of());

    ExtractedEntitySet entities = extractor.extract("Fees: $250.00, $1,000,000 and $75.5 later.");

    // $75.5 has a single decimal digit, so only "$75" matches
    assertThat(entities.get(EntityCategory.MONETARY_AMOUNTS))
        .containsExactly("$250.00", "$1,000,000", "$75");
  }

  @Test
  @DisplayName("Should deduplicate recognizer spans per category in first-occurrence order")
  void shouldDeduplicateRecognizerSpans() {
    when(entityRecognizer.annotate(anyString()))
        .thenReturn(
            List.of(
                new RecognizedSpan("ORG", "Acme Corp"),
                new RecognizedSpan("PERSON", "Jane Doe"),
                new RecognizedSpan("ORG", "Tech Innovations Inc."),
                new RecognizedSpan("ORG", "Acme Corp"),
                new RecognizedSpan("PERSON", "Jane Doe")));

    ExtractedEntitySet entities = extractor.extract("irrelevant");

    assertThat(entities.get(EntityCategory.ORG))
        .containsExactly("Acme Corp", "Tech Innovations Inc.");
    assertThat(entities.get(EntityCategory.PERSON)).containsExactly("Jane Doe");
  }

  @Test
  void shouldKeepSameTextUnderDifferentCategories() {
    when(entityRecognizer.annotate(anyString()))
        .thenReturn(
            List.of(
                new RecognizedSpan("ORG", "Washington"), new RecognizedSpan("GPE", "Washington")));

    ExtractedEntitySet entities = extractor.extract("irrelevant");

    assertThat(entities.get(EntityCategory.ORG)).containsExactly("Washington");
    assertThat(entities.get(EntityCategory.GPE)).containsExactly("Washington");
  }

  @Test
  @DisplayName("Should silently discard labels outside the kept categories")
  void shouldDiscardOtherLabels() {
    when(entityRecognizer.annotate(anyString()))
        .thenReturn(
            List.of(
                new RecognizedSpan("NORP", "American"),
                new RecognizedSpan("CARDINAL", "three"),
                new RecognizedSpan("DATE", "January 1, 2024")));

    ExtractedEntitySet entities = extractor.extract("irrelevant");

    assertThat(entities.get(EntityCategory.DATE)).containsExactly("January 1, 2024");
    assertThat(entities.size()).isEqualTo(1);
    assertThat(entities.asMap()).containsOnlyKeys(EntityCategory.values());
  }

  @Test
  void shouldKeepMoneySpansApartFromRegexAmounts() {
    when(entityRecognizer.annotate(anyString()))
        .thenReturn(List.of(new RecognizedSpan("MONEY", "fifteen hundred dollars")));

    ExtractedEntitySet entities = extractor.extract("Pay $1,500 (fifteen hundred dollars).");

    assertThat(entities.get(EntityCategory.MONEY)).containsExactly("fifteen hundred dollars");
    assertThat(entities.get(EntityCategory.MONETARY_AMOUNTS)).containsExactly("$1,500");
  }

  @Test
  @DisplayName("Should fail with CollaboratorUnavailable when the recognizer fails")
  void shouldThrowCollaboratorUnavailable_whenRecognizerFails() {
    when(entityRecognizer.annotate(anyString())).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> extractor.extract("text"))
        .isInstanceOf(CollaboratorUnavailableException.class)
        .hasMessageContaining("boom")
        .extracting(e -> ((CollaboratorUnavailableException) e).getCollaborator())
        .isEqualTo("entity recognition");
  }

  @Test
  void shouldPropagateCollaboratorUnavailableUnchanged() {
    CollaboratorUnavailableException failure =
        new CollaboratorUnavailableException("entity recognition", "circuit open");
    when(entityRecognizer.annotate(anyString())).thenThrow(failure);

    assertThatThrownBy(() -> extractor.extract("text")).isSameAs(failure);
  }
}
