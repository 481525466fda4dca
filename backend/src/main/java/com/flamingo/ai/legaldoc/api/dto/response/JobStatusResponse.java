package com.flamingo.ai.legaldoc.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.legaldoc.service.analysis.model.AnalysisResult;
import com.flamingo.ai.legaldoc.service.job.AnalysisJob;
import com.flamingo.ai.legaldoc.service.job.JobStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a job status query. Results and error appear only once the job ends. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

  private String taskId;
  private JobStatus status;
  private Integer progress;
  private AnalysisResult results;
  private String error;
  private UUID documentId;
  private Instant createdAt;
  private Instant updatedAt;

  /** Creates a JobStatusResponse from a job snapshot. */
  public static JobStatusResponse fromJob(AnalysisJob job) {
    return JobStatusResponse.builder()
        .taskId(job.id())
        .status(job.status())
        .progress(job.progress())
        .results(job.result())
        .error(job.error())
        .documentId(job.documentId())
        .createdAt(job.createdAt())
        .updatedAt(job.updatedAt())
        .build();
  }
}
