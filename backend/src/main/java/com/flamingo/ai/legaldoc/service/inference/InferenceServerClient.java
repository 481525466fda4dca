package com.flamingo.ai.legaldoc.service.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.legaldoc.config.LegalAnalysisProperties;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the model server hosting the NER, extractive QA and summarization models.
 * Encapsulates all WebClient communication; every call is bounded by the configured read timeout.
 */
@Component
@Slf4j
public class InferenceServerClient {

  private final WebClient webClient;
  private final Duration readTimeout;

  public InferenceServerClient(LegalAnalysisProperties properties) {
    LegalAnalysisProperties.Inference inference = properties.getInference();
    this.readTimeout = Duration.ofMillis(inference.getReadTimeoutMs());
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, inference.getConnectTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(inference.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info(
        "Inference server client initialized: baseUrl={}, readTimeoutMs={}",
        inference.getBaseUrl(),
        inference.getReadTimeoutMs());
  }

  /** Calls {@code POST /ner}. */
  public List<NerEntity> recognizeEntities(String text) {
    return webClient
        .post()
        .uri("/ner")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(new NerRequest(text))
        .retrieve()
        .bodyToFlux(NerEntity.class)
        .collectList()
        .timeout(readTimeout)
        .block();
  }

  /** Calls {@code POST /qa}. */
  public QaResponse answer(String question, String context) {
    return webClient
        .post()
        .uri("/qa")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(new QaRequest(question, context))
        .retrieve()
        .bodyToMono(QaResponse.class)
        .timeout(readTimeout)
        .block();
  }

  /** Calls {@code POST /summarize}. */
  public SummarizeResponse summarize(String text, SummarizationModel.GenerationSettings settings) {
    var parameters =
        new SummarizeParameters(
            settings.maxLength(),
            settings.minLength(),
            settings.numBeams(),
            settings.lengthPenalty(),
            settings.earlyStopping(),
            true);
    return webClient
        .post()
        .uri("/summarize")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(new SummarizeRequest(text, parameters))
        .retrieve()
        .bodyToMono(SummarizeResponse.class)
        .timeout(readTimeout)
        .block();
  }

  record NerRequest(String text) {}

  /** Entity returned by the NER endpoint. */
  public record NerEntity(String label, String text) {}

  record QaRequest(String question, String context) {}

  /** Answer returned by the QA endpoint. */
  public record QaResponse(String answer, double score) {}

  record SummarizeRequest(String text, SummarizeParameters parameters) {}

  record SummarizeParameters(
      @JsonProperty("max_length") int maxLength,
      @JsonProperty("min_length") int minLength,
      @JsonProperty("num_beams") int numBeams,
      @JsonProperty("length_penalty") double lengthPenalty,
      @JsonProperty("early_stopping") boolean earlyStopping,
      boolean truncation) {}

  /** Summary returned by the summarization endpoint. */
  public record SummarizeResponse(@JsonProperty("summary_text") String summaryText) {}
}
