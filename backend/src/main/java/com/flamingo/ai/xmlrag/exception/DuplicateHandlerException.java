package com.flamingo.ai.xmlrag.exception;

/** Exception thrown when a handler id is registered twice. */
public class DuplicateHandlerException extends RuntimeException {

  private final String handlerId;

  public DuplicateHandlerException(String handlerId) {
    super("Handler already registered: " + handlerId);
    this.handlerId = handlerId;
  }

  public String getHandlerId() {
    return handlerId;
  }
}
