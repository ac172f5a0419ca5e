package com.flamingo.ai.wikistructure.exception;

/** Exception thrown when a wiki document cannot be read, parsed or written. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentName;
  private final String userMessage;

  public DocumentProcessingException(String documentName, String message) {
    super(message);
    this.documentName = documentName;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentName, String message, Throwable cause) {
    super(message, cause);
    this.documentName = documentName;
    this.userMessage = "Failed to process document";
  }

  public String getDocumentName() {
    return documentName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
