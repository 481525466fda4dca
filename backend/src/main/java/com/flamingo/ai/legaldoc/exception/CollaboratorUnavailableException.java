package com.flamingo.ai.legaldoc.exception;

/**
 * Exception thrown when a required external collaborator (NER, question answering,
 * summarization or PDF extraction) cannot be reached or fails.
 */
public class CollaboratorUnavailableException extends RuntimeException {

  private final String collaborator;
  private final String userMessage;

  public CollaboratorUnavailableException(String collaborator, String message) {
    super(message);
    this.collaborator = collaborator;
    this.userMessage = defaultUserMessage(collaborator);
  }

  public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
    super(message, cause);
    this.collaborator = collaborator;
    this.userMessage = defaultUserMessage(collaborator);
  }

  public String getCollaborator() {
    return collaborator;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String defaultUserMessage(String collaborator) {
    return "The " + collaborator + " service is temporarily unavailable. Please try again later.";
  }
}
