package com.kyc.vision.app.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Vision model configuration for Spring AI.
 *
 * <p>Spring AI autoconfigures the {@link OpenAiChatModel} from {@code spring.ai.openai.*}; any
 * OpenAI-compatible endpoint (Groq, Ollama, vLLM) works by pointing {@code base-url} at it.
 */
@Configuration
public class VisionModelConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }
}
