package com.flamingo.ai.pitchscoop.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models used by the analysis gateway. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.2}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:1500}")
  private int maxCompletionTokens;

  /** Kept below the scoring tier deadlines so a slow call fails inside its tier. */
  @Value("${langchain4j.openai.chat-model.timeout:40s}")
  private Duration chatTimeout;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** JSON-mode chat model; scoring prompts always expect a JSON object back. */
  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(openAiApiKey)
            .modelName(chatModelName)
            .temperature(temperature)
            .maxCompletionTokens(maxCompletionTokens)
            .timeout(chatTimeout)
            .maxRetries(0)
            .responseFormat("json_object")
            .logRequests(false)
            .logResponses(false);
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(embeddingModelName)
            .dimensions(embeddingDimensions)
            .timeout(Duration.ofSeconds(30));
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
