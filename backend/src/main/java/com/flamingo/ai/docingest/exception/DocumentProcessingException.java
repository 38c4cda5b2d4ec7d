package com.flamingo.ai.docingest.exception;

/** Exception thrown when a batch of pages cannot be prepared for indexing. */
public class DocumentProcessingException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public DocumentProcessingException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String source, String message, String userMessage) {
    super(message);
    this.source = source;
    this.userMessage = userMessage;
  }

  /** URL or file the failing batch was ingested from. */
  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
