package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Maven project descriptors ({@code pom.xml}). */
@Component
@Order(20)
public class MavenPomHandler implements FormatHandler {

  @Override
  public String id() {
    return "maven-pom";
  }

  @Override
  public String displayName() {
    return "Maven POM";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    if (!root.localName().equals("project")) {
      return DetectionResult.none();
    }
    if (document.declaresNamespace("maven.apache.org/POM")) {
      return DetectionResult.of(1.0, "root is <project>", "Maven POM namespace");
    }
    if (root.hasDescendant("groupId") && root.hasDescendant("artifactId")) {
      return DetectionResult.of(0.8, "root is <project>", "has groupId and artifactId");
    }
    return DetectionResult.none();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    XmlElement parent = root.child("parent");
    String groupId = root.childText("groupId");
    if (groupId == null && parent != null) {
      groupId = parent.childText("groupId");
    }
    String packaging = root.childText("packaging");
    summary
        .field("modelVersion", root.childText("modelVersion"))
        .field("groupId", groupId)
        .field("artifactId", root.childText("artifactId"))
        .field("version", root.childText("version"))
        .field("packaging", packaging != null ? packaging : "jar")
        .field("name", root.childText("name"));
    if (parent != null) {
      summary.field("parent", coordinates(parent));
    }

    XmlElement modules = root.child("modules");
    if (modules != null) {
      summary.field("modules", modules.values("module"));
    }
    XmlElement dependencies = root.child("dependencies");
    if (dependencies != null) {
      List<String> coordinates = new ArrayList<>();
      for (XmlElement dependency : dependencies.children("dependency")) {
        coordinates.add(coordinates(dependency));
      }
      summary.field("dependencies", coordinates);
    }
    summary.field("pluginCount", root.descendants("plugin").size());
    summary.field("profileCount", root.descendants("profile").size());

    summary
        .boundary("//profile", "profile", "id")
        .boundary("//dependency", "dependency", "artifactId")
        .boundary("//plugin", "plugin", "artifactId");
  }

  private static String coordinates(XmlElement element) {
    StringBuilder sb = new StringBuilder();
    sb.append(element.childText("groupId")).append(':').append(element.childText("artifactId"));
    String version = element.childText("version");
    if (version != null) {
      sb.append(':').append(version);
    }
    String scope = element.childText("scope");
    if (scope != null) {
      sb.append(" (").append(scope).append(')');
    }
    return sb.toString();
  }
}
