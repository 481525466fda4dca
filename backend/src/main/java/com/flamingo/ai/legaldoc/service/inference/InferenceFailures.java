package com.flamingo.ai.legaldoc.service.inference;

import com.flamingo.ai.legaldoc.exception.CollaboratorUnavailableException;

/** Maps circuit breaker fallbacks onto {@link CollaboratorUnavailableException}. */
final class InferenceFailures {

  private InferenceFailures() {}

  static CollaboratorUnavailableException unavailable(String collaborator, Throwable t) {
    if (t instanceof CollaboratorUnavailableException e) {
      return e;
    }
    return new CollaboratorUnavailableException(
        collaborator, collaborator + " unavailable: " + t.getMessage(), t);
  }
}
