package com.aiadvent.mcp.pages.tools;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class RepositoryToolConfiguration {

  @Bean
  ToolCallbackProvider repositoryToolCallbackProvider(RepositoryTools tools) {
    return MethodToolCallbackProvider.builder().toolObjects(tools).build();
  }
}
