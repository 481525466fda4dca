package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import java.util.List;

/** Clause questions asked of a document, chosen by its predicted type. */
public enum ClauseQuestionSet {
  CONTRACT(
      List.of(
          "What is the effective date?",
          "Who are the parties?",
          "What are the payment terms?",
          "What is the governing law?")),
  EMPLOYMENT(
      List.of(
          "What is the salary?",
          "What is the job title?",
          "When does employment start?",
          "What are the benefits?")),
  GENERIC(
      List.of(
          "What are the main terms?",
          "Who are the parties involved?",
          "What are the key obligations?"));

  private final List<String> questions;

  ClauseQuestionSet(List<String> questions) {
    this.questions = questions;
  }

  public List<String> questions() {
    return questions;
  }

  public static ClauseQuestionSet forType(DocumentType type) {
    if (type == null) {
      return GENERIC;
    }
    return switch (type) {
      case CONTRACT -> CONTRACT;
      case EMPLOYMENT -> EMPLOYMENT;
      default -> GENERIC;
    };
  }
}
