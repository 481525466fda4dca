package com.flamingo.ai.legaldoc.service.job;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.exception.TextExtractionException;
import com.flamingo.ai.legaldoc.service.analysis.DocumentAnalysisOrchestrator;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import com.flamingo.ai.legaldoc.service.document.AnalysisRecorder;
import com.flamingo.ai.legaldoc.service.pdf.PdfTextExtractor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs a submitted PDF through text extraction and analysis, reporting each stage to the {@link
 * JobTracker}. Every outcome ends the job in COMPLETED or ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfAnalysisJobRunner {

  private final JobTracker jobTracker;
  private final PdfTextExtractor pdfTextExtractor;
  private final DocumentAnalysisOrchestrator orchestrator;
  private final AnalysisRecorder analysisRecorder;
  private final Clock clock;

  /**
   * Processes a PDF for an already submitted job.
   *
   * @param jobId id returned by {@link JobTracker#submit()}
   * @param fileName the uploaded file name
   * @param content the PDF bytes
   */
  @Async("documentProcessingExecutor")
  public void runAsync(String jobId, String fileName, byte[] content) {
    log.info("Processing PDF {} for job {}", fileName, jobId);
    Instant started = clock.instant();
    String text = "";

    try {
      jobTracker.markExtractingText(jobId);
      text = pdfTextExtractor.extract(content);
      if (text == null || text.isBlank()) {
        throw new TextExtractionException(TextExtractionException.NO_TEXT_MESSAGE);
      }

      jobTracker.markAnalyzing(jobId);
      AnalysisResult result = orchestrator.analyze(text);

      UUID documentId =
          analysisRecorder
              .recordSuccess(
                  RawDocument.ofFile(text, fileName, content),
                  result,
                  Duration.between(started, clock.instant()))
              .orElse(null);
      jobTracker.complete(jobId, result, documentId);
    } catch (TextExtractionException e) {
      log.error("Text extraction failed for job {}: {}", jobId, e.getMessage());
      failJob(jobId, fileName, content, text, e.getMessage());
    } catch (CollaboratorUnavailableException e) {
      log.error("Analysis failed for job {}, {} unavailable", jobId, e.getCollaborator(), e);
      failJob(jobId, fileName, content, text, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error processing job {}: {}", jobId, e.getMessage(), e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      failJob(jobId, fileName, content, text, message);
    }
  }

  private void failJob(
      String jobId, String fileName, byte[] content, String text, String errorMessage) {
    jobTracker.fail(jobId, errorMessage);
    analysisRecorder.recordFailure(
        RawDocument.ofFile(text == null ? "" : text, fileName, content), errorMessage);
  }
}
