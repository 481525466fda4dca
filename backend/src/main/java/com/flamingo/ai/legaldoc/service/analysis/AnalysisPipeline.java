package com.flamingo.ai.legaldoc.service.analysis;

import java.util.Objects;

/**
 * The pipeline stages, built once at startup and shared by every analysis.
 *
 * <p>Stages hold no per-call state, so one handle serves concurrent analyses.
 */
public final class AnalysisPipeline {

  private final TextNormalizer normalizer;
  private final DocumentClassifier classifier;
  private final EntityExtractor entityExtractor;
  private final ClauseExtractor clauseExtractor;
  private final Summarizer summarizer;

  public AnalysisPipeline(
      TextNormalizer normalizer,
      DocumentClassifier classifier,
      EntityExtractor entityExtractor,
      ClauseExtractor clauseExtractor,
      Summarizer summarizer) {
    this.normalizer = Objects.requireNonNull(normalizer);
    this.classifier = Objects.requireNonNull(classifier);
    this.entityExtractor = Objects.requireNonNull(entityExtractor);
    this.clauseExtractor = Objects.requireNonNull(clauseExtractor);
    this.summarizer = Objects.requireNonNull(summarizer);
  }

  public TextNormalizer normalizer() {
    return normalizer;
  }

  public DocumentClassifier classifier() {
    return classifier;
  }

  public EntityExtractor entityExtractor() {
    return entityExtractor;
  }

  public ClauseExtractor clauseExtractor() {
    return clauseExtractor;
  }

  public Summarizer summarizer() {
    return summarizer;
  }
}
