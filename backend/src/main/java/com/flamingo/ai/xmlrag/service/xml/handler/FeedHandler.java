package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** RSS 2.0 and Atom feeds; one chunk per item or entry. */
@Component
@Order(70)
public class FeedHandler implements FormatHandler {

  @Override
  public String id() {
    return "rss-atom-feed";
  }

  @Override
  public String displayName() {
    return "RSS/Atom Feed";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    String root = document.root().localName();
    if (root.equals("rss")) {
      return DetectionResult.of(1.0, "root is <rss>");
    }
    if (root.equals("feed")) {
      return DetectionResult.signals()
          .add(true, 0.7, "root is <feed>")
          .add(document.declaresNamespace("w3.org/2005/Atom"), 0.2, "Atom namespace")
          .result();
    }
    return DetectionResult.none();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    if (root.localName().equals("rss")) {
      XmlElement channel = root.child("channel");
      List<XmlElement> items = channel == null ? List.of() : channel.children("item");
      summary.field("standard", "RSS").field("version", root.attribute("version"));
      if (channel != null) {
        summary
            .field("title", channel.childText("title"))
            .field("link", channel.childText("link"))
            .field("language", channel.childText("language"));
      }
      summary.field("itemCount", items.size());
      summary.field("itemTitles", titles(items));
      summary.boundary("rss/channel/item", "item", "guid");
      return;
    }
    List<XmlElement> entries = root.children("entry");
    summary
        .field("standard", "Atom")
        .field("title", root.childText("title"))
        .field("updated", root.childText("updated"))
        .field("itemCount", entries.size())
        .field("itemTitles", titles(entries));
    summary.boundary("feed/entry", "entry", "id");
  }

  private static List<String> titles(List<XmlElement> items) {
    return items.stream().map(i -> i.childText("title")).filter(t -> t != null).toList();
  }
}
