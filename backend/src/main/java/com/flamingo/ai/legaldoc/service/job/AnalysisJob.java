package com.flamingo.ai.legaldoc.service.job;

import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable snapshot of an asynchronous analysis job.
 *
 * @param id the job id
 * @param status current stage
 * @param progress percentage in [0, 100]
 * @param result the analysis, present once COMPLETED
 * @param error failure message, present once ERROR
 * @param documentId id of the stored document, when the completed analysis was persisted
 * @param createdAt submission time
 * @param updatedAt time of the last transition
 */
public record AnalysisJob(
    String id,
    JobStatus status,
    int progress,
    AnalysisResult result,
    String error,
    UUID documentId,
    Instant createdAt,
    Instant updatedAt) {

  static AnalysisJob starting(String id, Instant now) {
    return new AnalysisJob(id, JobStatus.STARTING, 0, null, null, null, now, now);
  }

  AnalysisJob advanceTo(JobStatus next, Instant now) {
    if (next == JobStatus.COMPLETED || next == JobStatus.ERROR) {
      throw new IllegalArgumentException("Use complete() or fail() to finish a job");
    }
    checkTransition(next);
    return new AnalysisJob(
        id, next, next.progressOnEntry(progress), null, null, null, createdAt, now);
  }

  AnalysisJob complete(AnalysisResult analysis, UUID storedDocumentId, Instant now) {
    checkTransition(JobStatus.COMPLETED);
    return new AnalysisJob(
        id, JobStatus.COMPLETED, 100, analysis, null, storedDocumentId, createdAt, now);
  }

  AnalysisJob fail(String message, Instant now) {
    checkTransition(JobStatus.ERROR);
    return new AnalysisJob(
        id,
        JobStatus.ERROR,
        JobStatus.ERROR.progressOnEntry(progress),
        null,
        message,
        null,
        createdAt,
        now);
  }

  public Optional<AnalysisResult> analysis() {
    return Optional.ofNullable(result);
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }

  private void checkTransition(JobStatus next) {
    if (!status.canAdvanceTo(next)) {
      throw new IllegalJobTransitionException(id, status, next);
    }
  }
}
