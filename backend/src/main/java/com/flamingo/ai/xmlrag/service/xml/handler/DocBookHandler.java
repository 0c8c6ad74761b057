package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * DocBook books and articles.
 *
 * <p>Chapters, appendices and prefaces are the outer boundaries; documents without chapters are
 * chunked by top-level section. Long chapters are split later by the chunker at section level.
 */
@Component
@Order(80)
public class DocBookHandler implements FormatHandler {

  private static final Set<String> ROOTS = Set.of("book", "article", "chapter", "part");

  @Override
  public String id() {
    return "docbook";
  }

  @Override
  public String displayName() {
    return "DocBook Document";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    boolean docbookRoot = ROOTS.contains(root.localName());
    return DetectionResult.signals()
        .decisive(document.declaresNamespace("docbook.org"), 1.0, "DocBook namespace")
        .add(docbookRoot, 0.5, "root is <" + root.localName() + ">")
        .add(
            docbookRoot && (root.hasDescendant("para") || root.hasDescendant("simpara")),
            0.3,
            "contains <para>")
        .result();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    String title = root.childText("title");
    if (title == null) {
      XmlElement info = root.child("info") != null ? root.child("info") : root.child("bookinfo");
      title = info == null ? null : info.childText("title");
    }
    summary
        .field("documentKind", root.localName())
        .field("version", root.attribute("version"))
        .field("title", title)
        .field("chapterTitles", root.values("chapter/title"))
        .field("sectionCount", countSections(root))
        .field("hasAppendix", root.hasDescendant("appendix"));

    summary
        .boundary("//preface", "preface", "@id")
        .boundary("//chapter", "chapter", "@id")
        .boundary("//appendix", "appendix", "@id")
        .boundary("//section", "section", "@id")
        .boundary("//sect1", "section", "@id");
  }

  private static int countSections(XmlElement root) {
    int count = 0;
    for (String name : new String[] {"section", "sect1", "sect2", "sect3"}) {
      count += root.descendants(name).size();
    }
    return count;
  }
}
