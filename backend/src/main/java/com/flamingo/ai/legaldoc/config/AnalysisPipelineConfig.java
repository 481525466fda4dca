package com.flamingo.ai.legaldoc.config;

import com.flamingo.ai.legaldoc.service.analysis.AnalysisPipeline;
import com.flamingo.ai.legaldoc.service.analysis.ClauseExtractor;
import com.flamingo.ai.legaldoc.service.analysis.DocumentClassifier;
import com.flamingo.ai.legaldoc.service.analysis.EntityExtractor;
import com.flamingo.ai.legaldoc.service.analysis.Summarizer;
import com.flamingo.ai.legaldoc.service.analysis.TextNormalizer;
import com.flamingo.ai.legaldoc.service.inference.EntityRecognizer;
import com.flamingo.ai.legaldoc.service.inference.QuestionAnsweringModel;
import com.flamingo.ai.legaldoc.service.inference.SummarizationModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Assembles the analysis pipeline from the configured model collaborators. */
@Configuration
@Slf4j
public class AnalysisPipelineConfig {

  @Bean
  public AnalysisPipeline analysisPipeline(
      EntityRecognizer entityRecognizer,
      QuestionAnsweringModel questionAnsweringModel,
      SummarizationModel summarizationModel,
      LegalAnalysisProperties properties,
      MeterRegistry meterRegistry) {
    LegalAnalysisProperties.Summary summary = properties.getSummary();
    SummarizationModel.GenerationSettings settings =
        new SummarizationModel.GenerationSettings(
            summary.getMaxLength(),
            summary.getMinLength(),
            summary.getNumBeams(),
            summary.getLengthPenalty(),
            summary.isEarlyStopping());

    log.info(
        "Analysis pipeline ready: summarizer={}, summary settings={}, clause floor={}",
        summarizationModel.getClass().getSimpleName(),
        settings,
        properties.getClauses().getConfidenceFloor());

    return new AnalysisPipeline(
        new TextNormalizer(),
        new DocumentClassifier(),
        new EntityExtractor(entityRecognizer),
        new ClauseExtractor(
            questionAnsweringModel, properties.getClauses().getConfidenceFloor(), meterRegistry),
        new Summarizer(summarizationModel, settings, summary.getMaxInputTokens()));
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
