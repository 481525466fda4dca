package com.flamingo.ai.legaldoc.service.analysis;

import com.flamingo.ai.legaldoc.domain.enums.DocumentType;
import com.flamingo.ai.legaldoc.service.analysis.model.KeyClause;
import com.flamingo.ai.legaldoc.service.inference.QuestionAnsweringModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts key clauses by asking the question set for the document's type.
 *
 * <p>Questions are independent: a failed question is logged, counted and left out, and the rest
 * still run. Answers scoring at or below the confidence floor are dropped.
 */
@Slf4j
public class ClauseExtractor {

  private static final List<String> QUESTION_PREFIXES = List.of("What is ", "What are ");
  static final String NO_ANSWER = "model returned no answer";
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s?.!:;]+$");

  private final QuestionAnsweringModel questionAnsweringModel;
  private final double confidenceFloor;
  private final MeterRegistry meterRegistry;

  public ClauseExtractor(
      QuestionAnsweringModel questionAnsweringModel,
      double confidenceFloor,
      MeterRegistry meterRegistry) {
    this.questionAnsweringModel = questionAnsweringModel;
    this.confidenceFloor = confidenceFloor;
    this.meterRegistry = meterRegistry;
  }

  public ClauseExtraction extract(String text, DocumentType documentType) {
    ClauseQuestionSet questionSet = ClauseQuestionSet.forType(documentType);

    Map<String, KeyClause> clauses = new LinkedHashMap<>();
    List<ClauseAttempt> failures = new ArrayList<>();

    for (String question : questionSet.questions()) {
      ClauseAttempt attempt = ask(question, text);
      if (attempt.isFailure()) {
        failures.add(attempt);
        continue;
      }
      // a later question with the same key replaces the earlier clause
      attempt.toClause(confidenceFloor).ifPresent(clause -> clauses.put(clause.key(), clause));
    }

    log.debug(
        "Clause extraction ({}): {} kept, {} failed of {} questions",
        questionSet,
        clauses.size(),
        failures.size(),
        questionSet.questions().size());
    return new ClauseExtraction(clauses, failures);
  }

  private ClauseAttempt ask(String question, String text) {
    QuestionAnsweringModel.Answer answer;
    try {
      answer = questionAnsweringModel.answer(question, text);
    } catch (RuntimeException e) {
      return failed(question, e.getMessage());
    }
    if (answer == null) {
      return failed(question, NO_ANSWER);
    }
    return ClauseAttempt.answered(question, answer);
  }

  private ClauseAttempt failed(String question, String reason) {
    log.warn("Error extracting clause for question '{}': {}", question, reason);
    meterRegistry.counter("analysis.clause.failures").increment();
    return ClauseAttempt.failed(question, reason);
  }

  /**
   * Derives a clause key from its question, e.g. "What are the payment terms?" becomes "the
   * payment terms".
   */
  static String clauseKey(String question) {
    String key = question.strip();
    for (String prefix : QUESTION_PREFIXES) {
      if (key.startsWith(prefix)) {
        key = key.substring(prefix.length());
        break;
      }
    }
    return TRAILING_PUNCTUATION.matcher(key).replaceAll("");
  }

  /**
   * Clauses kept from one extraction, plus the questions that failed.
   *
   * @param clauses kept clauses by key, in question order
   * @param failures attempts whose model call failed
   */
  public record ClauseExtraction(Map<String, KeyClause> clauses, List<ClauseAttempt> failures) {

    public ClauseExtraction {
      clauses = Collections.unmodifiableMap(new LinkedHashMap<>(clauses));
      failures = List.copyOf(failures);
    }
  }
}
