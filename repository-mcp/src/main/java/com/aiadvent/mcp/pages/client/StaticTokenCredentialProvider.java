package com.aiadvent.mcp.pages.client;

import org.springframework.util.StringUtils;

/** Personal access token taken from configuration. */
public class StaticTokenCredentialProvider implements CredentialProvider {

  private final String token;

  public StaticTokenCredentialProvider(String token) {
    this.token = StringUtils.hasText(token) ? token.trim() : null;
  }

  @Override
  public String currentToken() {
    if (token == null) {
      throw new CredentialException(
          "Repository token is not configured (set repository.client.token)");
    }
    return token;
  }

  public boolean isConfigured() {
    return token != null;
  }
}
