package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Log4j configurations, both the 1.x {@code <log4j:configuration>} and the 2.x
 * {@code <Configuration>} dialect. Appenders and loggers become chunks; loggers reference the
 * appenders they write to.
 */
@Component
@Order(40)
public class Log4jConfigHandler implements FormatHandler {

  @Override
  public String id() {
    return "log4j-config";
  }

  @Override
  public String displayName() {
    return "Log4j Configuration";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    if (isVersion1(root)) {
      return DetectionResult.of(1.0, "root is <log4j:configuration>");
    }
    if (!root.localName().equals("Configuration")) {
      return DetectionResult.none();
    }
    return DetectionResult.signals()
        .decisive(
            root.attribute("status") != null || root.attribute("monitorInterval") != null,
            0.8,
            "Log4j 2 configuration attributes")
        .decisive(
            root.child("Appenders") != null || root.child("Loggers") != null,
            0.9,
            "has <Appenders> or <Loggers>")
        .result();
  }

  private static boolean isVersion1(XmlElement root) {
    return root.localName().equals("configuration")
        && ("log4j".equals(root.prefix())
            || (root.namespaceUri() != null && root.namespaceUri().contains("log4j")));
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    if (isVersion1(root)) {
      summary.field("version", "1.x");
      summary.field("appenders", describe(root.children("appender")));
      List<XmlElement> loggers = new ArrayList<>(root.children("logger"));
      loggers.addAll(root.children("category"));
      summary.field("loggers", names(loggers));
      XmlElement rootLogger = root.child("root");
      if (rootLogger != null) {
        String level = rootLogger.value("priority/@value");
        summary.field("rootLevel", level != null ? level : rootLogger.value("level/@value"));
      }
      summary
          .boundary("configuration/appender", "appender", "@name")
          .boundary("configuration/logger", "logger", "@name")
          .boundary("configuration/category", "logger", "@name")
          .boundary("configuration/root", "logger")
          .reference("configuration/*", "appender-ref/@ref", "appender");
      return;
    }

    summary.field("version", "2.x");
    summary.field("status", root.attribute("status"));
    XmlElement appenders = root.child("Appenders");
    if (appenders != null) {
      summary.field("appenders", describe(appenders.children()));
    }
    XmlElement loggers = root.child("Loggers");
    if (loggers != null) {
      summary.field("loggers", names(loggers.children()));
      XmlElement rootLogger = loggers.child("Root");
      if (rootLogger != null) {
        summary.field("rootLevel", rootLogger.attribute("level"));
      }
    }
    summary
        .boundary("Configuration/Appenders/*", "appender", "@name")
        .boundary("Configuration/Loggers/*", "logger", "@name")
        .reference("Configuration/Loggers/*", "AppenderRef/@ref", "appender");
  }

  private static List<String> describe(List<XmlElement> appenders) {
    List<String> result = new ArrayList<>();
    for (XmlElement appender : appenders) {
      String type = appender.attribute("class");
      if (type == null) {
        type = appender.localName();
      }
      result.add(appender.attribute("name") + " (" + type + ")");
    }
    return result;
  }

  private static List<String> names(List<XmlElement> loggers) {
    List<String> result = new ArrayList<>();
    for (XmlElement logger : loggers) {
      String name = logger.attribute("name");
      result.add(name != null ? name : logger.localName());
    }
    return result;
  }
}
