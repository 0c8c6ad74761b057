package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** JUnit-style XML test reports (Surefire, Gradle, pytest). */
@Component
@Order(100)
public class JUnitReportHandler implements FormatHandler {

  @Override
  public String id() {
    return "junit-report";
  }

  @Override
  public String displayName() {
    return "JUnit Test Report";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    boolean suiteRoot =
        root.localName().equals("testsuite") || root.localName().equals("testsuites");
    return DetectionResult.signals()
        .add(suiteRoot, 0.6, "root is <" + root.localName() + ">")
        .add(
            suiteRoot && (root.attribute("tests") != null || root.attribute("failures") != null),
            0.3,
            "suite counters present")
        .add(root.hasDescendant("testcase"), 0.1, "contains <testcase>")
        .resultAtLeast(0.6);
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    List<XmlElement> suites =
        root.localName().equals("testsuite") ? List.of(root) : root.descendants("testsuite");
    List<XmlElement> cases = root.descendants("testcase");
    List<String> failed = new ArrayList<>();
    int skipped = 0;
    for (XmlElement testCase : cases) {
      if (testCase.child("failure") != null || testCase.child("error") != null) {
        failed.add(testCase.attribute("classname") + "." + testCase.attribute("name"));
      }
      if (testCase.child("skipped") != null) {
        skipped++;
      }
    }
    List<String> suiteNames = new ArrayList<>();
    for (XmlElement suite : suites) {
      if (suite.attribute("name") != null) {
        suiteNames.add(suite.attribute("name"));
      }
    }
    summary
        .field("suiteCount", suites.size())
        .field("suiteNames", suiteNames)
        .field("testCount", cases.size())
        .field("failedCount", failed.size())
        .field("skippedCount", skipped)
        .field("failedTests", failed);

    summary.boundary("//testcase", "testcase", "@name");
  }
}
