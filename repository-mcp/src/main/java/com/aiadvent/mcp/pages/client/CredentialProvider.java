package com.aiadvent.mcp.pages.client;

/** Supplies the bearer token used for every remote call. */
public interface CredentialProvider {

  /**
   * @throws CredentialException when no usable token is available
   */
  String currentToken();

  default boolean needsRefresh() {
    return false;
  }

  /**
   * @throws CredentialException when the token cannot be refreshed
   */
  default void refresh() {}
}
