package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.exception.DocumentValidationException;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.ClassificationResult;
import com.flamingo.ai.legaldoc.service.analysis.model.DocumentInfo;
import com.flamingo.ai.legaldoc.service.analysis.model.ExtractedEntitySet;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the analysis pipeline: normalize, classify, extract entities, extract clauses, summarize,
 * assemble.
 *
 * <p>Every stage runs once, in that order, with no retries. Entity extraction and summarization
 * are required and abort the analysis when their model fails; clause questions fail one at a time
 * without affecting the result. Holds no per-call state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentAnalysisOrchestrator {

  private final AnalysisPipeline pipeline;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Analyzes raw document text.
   *
   * @param rawText the text as submitted
   * @return the assembled analysis
   * @throws DocumentValidationException if the text is null or blank
   * @throws CollaboratorUnavailableException if entity recognition or summarization fails
   */
  @Timed(value = "analysis.analyze", description = "Time to analyze a document")
  public AnalysisResult analyze(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      throw new DocumentValidationException(
          "Empty document text", "No document content provided");
    }

    try {
      String text = pipeline.normalizer().normalize(rawText);
      log.debug("Starting analysis of {} normalized chars", text.length());

      ClassificationResult classification = pipeline.classifier().classify(text);
      log.debug(
          "Document type: {} (confidence {})",
          classification.predictedType(),
          classification.confidence());

      ExtractedEntitySet entities = pipeline.entityExtractor().extract(text);

      ClauseExtractor.ClauseExtraction clauses =
          pipeline.clauseExtractor().extract(text, classification.predictedType());
      if (!clauses.failures().isEmpty()) {
        log.warn(
            "{} clause question(s) failed and were skipped", clauses.failures().size());
      }

      String summary = pipeline.summarizer().summarize(text);

      AnalysisResult result =
          new AnalysisResult(
              new DocumentInfo(
                  classification.predictedType(),
                  classification.confidence(),
                  countWords(text),
                  Instant.now(clock)),
              entities,
              clauses.clauses(),
              summary,
              classification.scores());

      meterRegistry
          .counter("analysis.completed", "type", classification.predictedType().value())
          .increment();
      log.info(
          "Document analysis completed: type={}, entities={}, clauses={}",
          classification.predictedType(),
          entities.size(),
          clauses.clauses().size());
      return result;
    } catch (CollaboratorUnavailableException e) {
      meterRegistry.counter("analysis.failed", "collaborator", e.getCollaborator()).increment();
      log.error("Document analysis failed, {} unavailable: {}", e.getCollaborator(), e.getMessage());
      throw e;
    }
  }

  static int countWords(String normalizedText) {
    return normalizedText.isEmpty() ? 0 : normalizedText.split(" ").length;
  }
}
