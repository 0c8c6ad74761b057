package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;

/**
 * Extracts a handler's summary fields and structural hints into the supplied builder.
 *
 * <p>Anything written to {@code summary} before an exception is thrown is kept as the partial
 * summary of the resulting {@link com.flamingo.ai.xmlrag.exception.ExtractionException}.
 */
@FunctionalInterface
public interface ExtractionFunction {

  void extract(ParsedDocument document, SummaryRecord.Builder summary);
}
