package com.flamingo.ai.legaldoc.config;

import com.flamingo.ai.legaldoc.agent.LegalSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model used by the LLM summarization strategy.
 *
 * <p>Only active when {@code legal.inference.summarization-strategy=llm}; the default strategy
 * talks to the model server and needs no API key.
 */
@Configuration
@ConditionalOnProperty(name = "legal.inference.summarization-strategy", havingValue = "llm")
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:512}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:60}")
  private int timeoutSeconds;

  @Bean
  public ChatModel summaryChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(0.0)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public LegalSummaryAgent legalSummaryAgent(ChatModel summaryChatModel) {
    return AiServices.builder(LegalSummaryAgent.class).chatModel(summaryChatModel).build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the llm summarization strategy. "
              + "Set OPENAI_API_KEY environment variable.");
    }
  }
}
