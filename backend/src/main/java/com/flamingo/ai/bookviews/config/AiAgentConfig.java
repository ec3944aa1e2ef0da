package com.flamingo.ai.bookviews.config;

import com.flamingo.ai.bookviews.agent.ViewSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j AI service agents. */
@Configuration
public class AiAgentConfig {

  /** Summary agent used for every view and every level of the map/reduce hierarchy. */
  @Bean
  public ViewSummaryAgent viewSummaryAgent(ChatModel chatModel) {
    return AiServices.builder(ViewSummaryAgent.class).chatModel(chatModel).build();
  }
}
