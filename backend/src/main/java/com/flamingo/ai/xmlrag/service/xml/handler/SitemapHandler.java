package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** sitemaps.org URL sets and sitemap indexes. */
@Component
@Order(90)
public class SitemapHandler implements FormatHandler {

  @Override
  public String id() {
    return "sitemap";
  }

  @Override
  public String displayName() {
    return "XML Sitemap";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    String root = document.root().localName();
    boolean sitemapRoot = root.equals("urlset") || root.equals("sitemapindex");
    return DetectionResult.signals()
        .decisive(
            document.declaresNamespace("sitemaps.org/schemas/sitemap"), 1.0, "sitemap namespace")
        .decisive(sitemapRoot, 0.8, "root is <" + root + ">")
        .result();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    if (root.localName().equals("sitemapindex")) {
      List<String> sitemaps = root.values("sitemap/loc");
      summary.field("sitemapType", "index").field("sitemapCount", sitemaps.size());
      summary.field("sitemaps", sitemaps);
      summary.boundary("sitemapindex/sitemap", "sitemap", "loc");
      return;
    }
    List<XmlElement> urls = root.children("url");
    Map<String, Integer> changeFrequencies = new LinkedHashMap<>();
    String lastModified = null;
    for (XmlElement url : urls) {
      String frequency = url.childText("changefreq");
      if (frequency != null) {
        changeFrequencies.merge(frequency, 1, Integer::sum);
      }
      String modified = url.childText("lastmod");
      if (modified != null && (lastModified == null || modified.compareTo(lastModified) > 0)) {
        lastModified = modified;
      }
    }
    summary
        .field("sitemapType", "urlset")
        .field("urlCount", urls.size())
        .field("changeFrequencies", changeFrequencies)
        .field("lastModified", lastModified);
    summary.boundary("urlset/url", "url", "loc");
  }
}
