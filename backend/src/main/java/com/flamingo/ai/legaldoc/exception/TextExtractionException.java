package com.flamingo.ai.legaldoc.exception;

/** Exception thrown when a PDF yields no usable text. */
public class TextExtractionException extends RuntimeException {

  public static final String NO_TEXT_MESSAGE = "Could not extract text from PDF";

  public TextExtractionException(String message) {
    super(message);
  }

  public TextExtractionException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return NO_TEXT_MESSAGE;
  }
}
