package com.flamingo.ai.legaldoc.service.job;

/** Thrown when a job is asked to move backwards or out of a terminal state. */
public class IllegalJobTransitionException extends IllegalStateException {

  public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
    super("Job " + jobId + " cannot move from " + from + " to " + to);
  }
}
