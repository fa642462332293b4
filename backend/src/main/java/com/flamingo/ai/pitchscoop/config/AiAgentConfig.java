package com.flamingo.ai.pitchscoop.config;

import com.flamingo.ai.pitchscoop.agent.PitchScoringAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** AI agents built with LangChain4j AI Services. */
@Configuration
public class AiAgentConfig {

  /** Pitch scoring agent on the JSON-mode chat model. */
  @Bean
  public PitchScoringAgent pitchScoringAgent(ChatModel chatModel) {
    return AiServices.builder(PitchScoringAgent.class).chatModel(chatModel).build();
  }
}
