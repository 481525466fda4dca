package com.flamingo.ai.legaldoc.domain.enums;

/** Outcome recorded for a stored document. */
public enum DocumentStatus {
  /** Analysis finished and its results are stored. */
  COMPLETED,

  /** Analysis failed; the document row keeps the error message. */
  FAILED
}
