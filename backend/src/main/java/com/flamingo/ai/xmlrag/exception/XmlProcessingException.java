package com.flamingo.ai.xmlrag.exception;

/** Base class of the failures the XML pipeline reports to its callers. */
public abstract class XmlProcessingException extends RuntimeException {

  private final String userMessage;

  protected XmlProcessingException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected XmlProcessingException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
