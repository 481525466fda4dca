package com.flamingo.ai.legaldoc.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted PDF submission. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmissionResponse {

  public static final String PROCESSING = "processing";

  private String taskId;
  private String status;

  public static JobSubmissionResponse processing(String taskId) {
    return new JobSubmissionResponse(taskId, PROCESSING);
  }
}
