package com.flamingo.ai.docingest.config;

import com.flamingo.ai.docingest.agent.CodeExampleTitleAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
@ConditionalOnProperty(prefix = "ingest.code-titles", name = "enabled", havingValue = "true")
public class AiAgentConfig {

  /** Code example title agent. Uses the plain-text chat model for free-form output. */
  @Bean
  public CodeExampleTitleAgent codeExampleTitleAgent(ChatModel textChatModel) {
    return AiServices.builder(CodeExampleTitleAgent.class).chatModel(textChatModel).build();
  }
}
