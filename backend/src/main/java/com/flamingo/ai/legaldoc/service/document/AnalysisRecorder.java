package com.flamingo.ai.legaldoc.service.document;

import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Records analysis outcomes in the document store without letting a storage failure replace the
 * outcome. A failed write is logged and counted, and the caller carries on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisRecorder {

  private final DocumentService documentService;
  private final MeterRegistry meterRegistry;

  /** Stores a finished analysis; returns the document id, or empty if the write failed. */
  public Optional<UUID> recordSuccess(
      RawDocument rawDocument, AnalysisResult result, Duration processingTime) {
    try {
      return Optional.of(
          documentService.saveAnalysis(rawDocument, result, processingTime).getId());
    } catch (RuntimeException e) {
      meterRegistry.counter("analysis.persistence.failures", "outcome", "completed").increment();
      log.error("Failed to store analysis result: {}", e.getMessage(), e);
      return Optional.empty();
    }
  }

  /** Stores a failed submission for auditing. */
  public void recordFailure(RawDocument rawDocument, String errorMessage) {
    try {
      documentService.saveFailure(rawDocument, errorMessage);
    } catch (RuntimeException e) {
      meterRegistry.counter("analysis.persistence.failures", "outcome", "failed").increment();
      log.error("Failed to store failed document: {}", e.getMessage(), e);
    }
  }
}
