package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fallback for any document no specialised handler claims.
 *
 * <p>Scores a constant 0.1 with priority 0, so it only wins when nothing else fires. A document
 * whose root has no children and no text scores 0 and stays unclassified. Supplies no hints; such
 * documents are chunked structurally.
 */
@Component
@Order(1000)
public class GenericXmlHandler implements FormatHandler {

  static final double FALLBACK_SCORE = 0.1;

  @Override
  public String id() {
    return "generic-xml";
  }

  @Override
  public String displayName() {
    return "Generic XML";
  }

  @Override
  public int priority() {
    return 0;
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    if (document.isEmpty()) {
      return DetectionResult.none();
    }
    return DetectionResult.of(FALLBACK_SCORE, "well-formed XML");
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    Map<String, Integer> childNames = new LinkedHashMap<>();
    for (XmlElement child : root.children()) {
      childNames.merge(child.localName(), 1, Integer::sum);
    }
    summary
        .documentType("Generic XML (" + root.localName() + ")")
        .field("rootElement", root.qualifiedName())
        .field("elementCount", document.elementCount())
        .field("maxDepth", document.maxDepth())
        .field("namespaces", document.namespaces())
        .field("childElements", childNames);
  }
}
