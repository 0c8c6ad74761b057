package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scalable Vector Graphics; top-level groups become chunks. */
@Component
@Order(110)
public class SvgHandler implements FormatHandler {

  private static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";
  private static final Set<String> SHAPES =
      Set.of("rect", "circle", "ellipse", "line", "polyline", "polygon", "path", "text");

  @Override
  public String id() {
    return "svg";
  }

  @Override
  public String displayName() {
    return "SVG Graphic";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    return DetectionResult.signals()
        .decisive(document.declaresNamespace(SVG_NAMESPACE), 0.9, "SVG namespace")
        .decisive(document.root().localName().equals("svg"), 1.0, "root is <svg>")
        .result();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    Map<String, Integer> shapes = new LinkedHashMap<>();
    for (XmlElement element : document.elements()) {
      if (SHAPES.contains(element.localName())) {
        shapes.merge(element.localName(), 1, Integer::sum);
      }
    }
    summary
        .field("title", root.childText("title"))
        .field("description", root.childText("desc"))
        .field("width", root.attribute("width"))
        .field("height", root.attribute("height"))
        .field("viewBox", root.attribute("viewBox"))
        .field("shapeCounts", shapes)
        .field("hasScripts", root.hasDescendant("script"))
        .field("hasAnimations", root.hasDescendant("animate"));

    summary.boundary("svg/g", "group", "@id");
  }
}
