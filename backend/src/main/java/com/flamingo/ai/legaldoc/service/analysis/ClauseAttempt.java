package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.service.analysis.model.KeyClause;
import com.flamingo.ai.legaldoc.service.inference.QuestionAnsweringModel;
import java.util.Optional;

/**
 * Outcome of asking one clause question: either an answer from the model or the reason the call
 * failed.
 */
public record ClauseAttempt(
    String question, QuestionAnsweringModel.Answer answer, String failureReason) {

  public static ClauseAttempt answered(String question, QuestionAnsweringModel.Answer answer) {
    return new ClauseAttempt(question, answer, null);
  }

  public static ClauseAttempt failed(String question, String failureReason) {
    return new ClauseAttempt(question, null, failureReason);
  }

  public boolean isFailure() {
    return answer == null;
  }

  /** The clause to keep, present only for an answer scoring strictly above the floor. */
  public Optional<KeyClause> toClause(double confidenceFloor) {
    if (isFailure() || answer.score() <= confidenceFloor) {
      return Optional.empty();
    }
    return Optional.of(
        new KeyClause(ClauseExtractor.clauseKey(question), answer.text(), answer.score(), question));
  }
}
