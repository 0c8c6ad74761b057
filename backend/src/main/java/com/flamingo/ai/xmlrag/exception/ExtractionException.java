package com.flamingo.ai.xmlrag.exception;

import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;

/**
 * Exception thrown when the winning handler's extraction fails.
 *
 * <p>{@link #getPartialSummary()} holds whatever the handler extracted before failing; its
 * structural hints remain usable for chunking.
 */
public class ExtractionException extends XmlProcessingException {

  private final String handlerId;
  private final SummaryRecord partialSummary;

  public ExtractionException(
      String handlerId, String message, SummaryRecord partialSummary, Throwable cause) {
    super(message, "Failed to extract a summary from the document", cause);
    this.handlerId = handlerId;
    this.partialSummary = partialSummary;
  }

  public String getHandlerId() {
    return handlerId;
  }

  public SummaryRecord getPartialSummary() {
    return partialSummary;
  }
}
