package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * ServiceNow {@code <unload>} exports.
 *
 * <p>An export holds one or more table records (incident, change_request, …) followed by journal
 * entries ({@code sys_journal_field}) and attachments that point back at their record through
 * {@code element_id} / {@code table_sys_id}. Those links are declared as grouped references so
 * each record is chunked together with its work notes and attachments.
 */
@Component
@Order(10)
public class ServiceNowExportHandler implements FormatHandler {

  private static final Set<String> SUPPORT_TABLES =
      Set.of("sys_journal_field", "sys_attachment", "sys_attachment_doc");

  @Override
  public String id() {
    return "servicenow-export";
  }

  @Override
  public String displayName() {
    return "ServiceNow Export";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    boolean displayValues =
        document.elements().stream().anyMatch(e -> e.attributes().containsKey("display_value"));
    return DetectionResult.signals()
        .add(root.localName().equals("unload"), 0.4, "root is <unload>")
        .add(root.hasDescendant("incident"), 0.3, "contains <incident>")
        .add(root.hasDescendant("sys_journal_field"), 0.2, "contains journal entries")
        .add(root.hasDescendant("sys_attachment"), 0.1, "contains attachments")
        .add(displayValues, 0.1, "uses display_value attributes")
        .resultAtLeast(0.5);
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    List<XmlElement> records = new ArrayList<>();
    for (XmlElement child : root.children()) {
      if (!SUPPORT_TABLES.contains(child.localName())) {
        records.add(child);
      }
    }
    summary.field("unloadDate", root.attribute("unload_date"));
    summary.field("recordCount", records.size());
    summary.field("journalCount", root.children("sys_journal_field").size());
    summary.field("attachmentCount", root.children("sys_attachment").size());

    if (!records.isEmpty()) {
      XmlElement primary = records.get(0);
      summary.field("primaryTable", primary.localName());
      Map<String, Object> ticket = new LinkedHashMap<>();
      for (String name :
          List.of("number", "short_description", "state", "priority", "assignment_group")) {
        String value = displayOrText(primary.child(name));
        if (value != null) {
          ticket.put(name, value);
        }
      }
      summary.field("primaryRecord", ticket);
    }

    summary
        .boundary("unload/sys_journal_field", "journal", "sys_id")
        .boundary("unload/sys_attachment", "attachment", "sys_id")
        .boundary("unload/sys_attachment_doc", "attachment-data", "sys_id")
        .boundary("unload/*", "record", "sys_id")
        .reference("unload/sys_journal_field", "element_id", "journal", true)
        .reference("unload/sys_attachment", "table_sys_id", "attachment", true)
        .reference("unload/sys_attachment_doc", "sys_attachment", "attachment-data", true);
  }

  /** Prefers the human-readable {@code display_value} attribute over the raw sys value. */
  private static String displayOrText(XmlElement element) {
    if (element == null) {
      return null;
    }
    String display = element.attribute("display_value");
    if (display != null && !display.isBlank()) {
      return display;
    }
    String text = element.textContent();
    return text.isEmpty() ? null : text;
  }
}
