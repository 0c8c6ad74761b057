package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;

/**
 * Scores how likely a handler is to own a document.
 *
 * <p>Must be a pure function of the document: no side effects, no I/O.
 */
@FunctionalInterface
public interface DetectionFunction {

  DetectionResult detect(ParsedDocument document);
}
