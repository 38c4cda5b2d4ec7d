package com.flamingo.ai.docingest.exception;

/** Raised when the title model cannot be reached or rejects a request. */
public class LlmServiceException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Code example titles are temporarily unavailable; snippets are indexed untitled.";

  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = USER_MESSAGE;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
