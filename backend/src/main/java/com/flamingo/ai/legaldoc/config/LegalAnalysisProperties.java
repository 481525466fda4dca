package com.flamingo.ai.legaldoc.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the legal document analysis pipeline. */
@Configuration
@ConfigurationProperties(prefix = "legal")
@Getter
@Setter
public class LegalAnalysisProperties {

  private Inference inference = new Inference();
  private Summary summary = new Summary();
  private Clauses clauses = new Clauses();
  private Jobs jobs = new Jobs();
  private Upload upload = new Upload();

  @Getter
  @Setter
  public static class Inference {
    /** Base URL of the model server hosting the NER, QA and summarization endpoints. */
    private String baseUrl = "http://localhost:8000";

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 60000;

    /** Summarization backend: "server" (seq2seq model on the model server) or "llm". */
    private String summarizationStrategy = "server";
  }

  @Getter
  @Setter
  public static class Summary {
    private int maxLength = 150;
    private int minLength = 30;
    private int numBeams = 4;
    private double lengthPenalty = 2.0;
    private boolean earlyStopping = true;

    /** Only this many leading tokens of the document reach the summarizer. */
    private int maxInputTokens = 512;
  }

  @Getter
  @Setter
  public static class Clauses {
    /** Answers must score strictly above this value to be kept. */
    private double confidenceFloor = 0.1;
  }

  @Getter
  @Setter
  public static class Jobs {
    /**
     * How long finished jobs stay queryable. Unset keeps them for the life of the process.
     */
    private Duration retention;

    private Duration sweepInterval = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }
}
