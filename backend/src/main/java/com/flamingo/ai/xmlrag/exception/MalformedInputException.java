package com.flamingo.ai.xmlrag.exception;

/** Exception thrown when the input is not well-formed XML. Raised before any handler runs. */
public class MalformedInputException extends XmlProcessingException {

  private static final String USER_MESSAGE = "The document is not well-formed XML";

  public MalformedInputException(String message) {
    super(message, USER_MESSAGE);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(message, USER_MESSAGE, cause);
  }
}
