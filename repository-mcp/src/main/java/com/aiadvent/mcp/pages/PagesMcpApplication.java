package com.aiadvent.mcp.pages;

import com.aiadvent.mcp.pages.config.RepositoryClientProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(
    scanBasePackages = {"com.aiadvent.mcp.pages.config", "com.aiadvent.mcp.pages.tools"})
@EnableConfigurationProperties(RepositoryClientProperties.class)
public class PagesMcpApplication {

  public static void main(String[] args) {
    SpringApplication.run(PagesMcpApplication.class, args);
  }
}
