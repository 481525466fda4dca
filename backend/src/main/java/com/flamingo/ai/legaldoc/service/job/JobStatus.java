package com.flamingo.ai.legaldoc.service.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stages of an asynchronous PDF analysis, in the only order a job may pass through them.
 * COMPLETED and ERROR are terminal and share the last rank.
 */
public enum JobStatus {
  STARTING("starting", 0, 0),
  EXTRACTING_TEXT("extracting_text", 1, 10),
  ANALYZING("analyzing", 2, 50),
  COMPLETED("completed", 3, 100),
  ERROR("error", 3, -1);

  private final String value;
  private final int rank;
  private final int progress;

  JobStatus(String value, int rank, int progress) {
    this.value = value;
    this.rank = rank;
    this.progress = progress;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /** Whether a job in this state may move to {@code next}. */
  public boolean canAdvanceTo(JobStatus next) {
    return !isTerminal() && next.rank > rank;
  }

  /** Progress reported on entering this state; ERROR keeps the job's previous progress. */
  int progressOnEntry(int previousProgress) {
    return progress < 0 ? previousProgress : progress;
  }
}
