package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** W3C XML Schema documents. Each top-level declaration is a chunk named by {@code @name}. */
@Component
@Order(60)
public class XmlSchemaHandler implements FormatHandler {

  @Override
  public String id() {
    return "xml-schema";
  }

  @Override
  public String displayName() {
    return "XML Schema Definition";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    if (!document.root().localName().equals("schema")) {
      return DetectionResult.none();
    }
    return DetectionResult.signals()
        .add(true, 0.7, "root is <schema>")
        .add(document.declaresNamespace("XMLSchema"), 0.3, "XML Schema namespace")
        .result();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    summary
        .field("targetNamespace", root.attribute("targetNamespace"))
        .field("elementFormDefault", root.attribute("elementFormDefault"))
        .field("version", root.attribute("version"))
        .field("elements", root.values("element/@name"))
        .field("complexTypes", root.values("complexType/@name"))
        .field("simpleTypes", root.values("simpleType/@name"))
        .field("imports", root.values("import/@namespace"));

    summary
        .boundary("schema/element", "element", "@name")
        .boundary("schema/complexType", "complexType", "@name")
        .boundary("schema/simpleType", "simpleType", "@name")
        .boundary("schema/group", "group", "@name")
        .boundary("schema/attributeGroup", "attributeGroup", "@name");
  }
}
