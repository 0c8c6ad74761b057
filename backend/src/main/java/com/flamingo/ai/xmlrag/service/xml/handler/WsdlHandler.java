package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** WSDL 1.1 {@code <definitions>} and WSDL 2.0 {@code <description>} documents. */
@Component
@Order(50)
public class WsdlHandler implements FormatHandler {

  @Override
  public String id() {
    return "wsdl";
  }

  @Override
  public String displayName() {
    return "WSDL Service Definition";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    String root = document.root().localName();
    if (root.equals("definitions")) {
      return DetectionResult.signals()
          .add(true, 0.7, "root is <definitions>")
          .add(document.declaresNamespace("schemas.xmlsoap.org/wsdl"), 0.3, "WSDL 1.1 namespace")
          .result();
    }
    if (root.equals("description") && document.declaresNamespace("w3.org/ns/wsdl")) {
      return DetectionResult.of(0.9, "root is <description>", "WSDL 2.0 namespace");
    }
    return DetectionResult.none();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    boolean v2 = root.localName().equals("description");
    summary
        .field("version", v2 ? "2.0" : "1.1")
        .field("name", root.attribute("name"))
        .field("targetNamespace", root.attribute("targetNamespace"))
        .field("services", root.values("service/@name"))
        .field("portTypes", root.values((v2 ? "interface" : "portType") + "/@name"))
        .field("bindings", root.values("binding/@name"));

    List<String> operations = new ArrayList<>();
    for (XmlElement portType : root.children(v2 ? "interface" : "portType")) {
      operations.addAll(portType.values("operation/@name"));
    }
    summary.field("operations", operations);
    summary.field("messageCount", root.children("message").size());

    String rootName = root.localName();
    summary.boundary(rootName + "/*", "component", "@name");
  }
}
