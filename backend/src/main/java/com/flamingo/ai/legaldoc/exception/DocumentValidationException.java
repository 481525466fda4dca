package com.flamingo.ai.legaldoc.exception;

/** Exception thrown when submitted input is empty, missing or of the wrong kind. */
public class DocumentValidationException extends RuntimeException {

  private final String userMessage;

  public DocumentValidationException(String message) {
    super(message);
    this.userMessage = message;
  }

  public DocumentValidationException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
