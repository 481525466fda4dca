package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.job.AnalysisJob;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Entry point for analysis requests arriving over the API. */
public interface AnalysisService {

  /**
   * Analyzes pasted text synchronously and stores the outcome.
   *
   * @param text the document text
   * @return the analysis plus the stored document id, if storing succeeded
   * @throws com.flamingo.ai.legaldoc.exception.DocumentValidationException if the text is blank
   * @throws com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException if a required
   *     model fails
   */
  AnalyzedDocument analyzeText(String text);

  /**
   * Validates an uploaded PDF and starts an asynchronous job for it.
   *
   * @param file the uploaded file
   * @return the new job id
   * @throws com.flamingo.ai.legaldoc.exception.DocumentValidationException if the file is
   *     missing, empty, too large or not a PDF
   */
  String submitPdf(MultipartFile file);

  /**
   * Gets the current state of a job.
   *
   * @param jobId the job id
   * @return a snapshot of the job
   * @throws com.flamingo.ai.legaldoc.exception.JobNotFoundException if the id is unknown
   */
  AnalysisJob getJob(String jobId);

  /**
   * A finished synchronous analysis.
   *
   * @param documentId id of the stored document, null when storing failed
   * @param result the analysis
   */
  record AnalyzedDocument(UUID documentId, AnalysisResult result) {}
}
