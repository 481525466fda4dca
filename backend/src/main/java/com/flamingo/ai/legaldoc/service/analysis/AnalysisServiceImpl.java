package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.config.LegalAnalysisProperties;
import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;
import com.flamingo.ai.legaldoc.exception.DocumentValidationException;
import com.flamingo.ai.legaldoc.exception.JobNotFoundException;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.analysis.model.RawDocument;
import com.flamingo.ai.legaldoc.service.document.AnalysisRecorder;
import com.flamingo.ai.legaldoc.service.job.AnalysisJob;
import com.flamingo.ai.legaldoc.service.job.JobTracker;
import com.flamingo.ai.legaldoc.service.job.PdfAnalysisJobRunner;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the AnalysisService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisServiceImpl implements AnalysisService {

  static final String EXECUTOR = "job executor";
  static final String REJECTED_MESSAGE = "Analysis queue is full, please retry later";

  private final DocumentAnalysisOrchestrator orchestrator;
  private final AnalysisRecorder analysisRecorder;
  private final JobTracker jobTracker;
  private final PdfAnalysisJobRunner pdfAnalysisJobRunner;
  private final LegalAnalysisProperties properties;
  private final Clock clock;

  @Override
  @Timed(value = "analysis.text", description = "Time to analyze submitted text")
  public AnalyzedDocument analyzeText(String text) {
    Instant started = clock.instant();
    AnalysisResult result;
    try {
      result = orchestrator.analyze(text);
    } catch (CollaboratorUnavailableException e) {
      analysisRecorder.recordFailure(RawDocument.ofText(text), e.getMessage());
      throw e;
    }

    UUID documentId =
        analysisRecorder
            .recordSuccess(
                RawDocument.ofText(text), result, Duration.between(started, clock.instant()))
            .orElse(null);
    return new AnalyzedDocument(documentId, result);
  }

  @Override
  public String submitPdf(MultipartFile file) {
    validatePdf(file);

    // Read bytes now; the multipart file is gone once the request completes
    final byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read uploaded file {}: {}", file.getOriginalFilename(), e.getMessage());
      throw new DocumentValidationException(
          "Failed to read file content: " + e.getMessage(), "Failed to read file content");
    }

    String jobId = jobTracker.submit();
    try {
      pdfAnalysisJobRunner.runAsync(jobId, file.getOriginalFilename(), content);
    } catch (TaskRejectedException e) {
      log.error("Job {} rejected by the document executor: {}", jobId, e.getMessage());
      jobTracker.fail(jobId, REJECTED_MESSAGE);
      throw new CollaboratorUnavailableException(EXECUTOR, REJECTED_MESSAGE, e);
    }
    log.info("PDF {} accepted as job {}", file.getOriginalFilename(), jobId);
    return jobId;
  }

  @Override
  public AnalysisJob getJob(String jobId) {
    return jobTracker.query(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private void validatePdf(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new DocumentValidationException("No file uploaded", "Please upload a PDF file");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      throw new DocumentValidationException(
          "Unsupported file: " + fileName, "Only PDF files are supported");
    }

    long maxBytes = properties.getUpload().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new DocumentValidationException(
          "File too large: " + file.getSize(),
          "Maximum file size is " + maxBytes / (1024 * 1024) + "MB");
    }
  }
}
