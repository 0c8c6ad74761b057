package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Spring XML application contexts. Every top-level bean is a chunk; {@code ref} attributes on
 * properties and constructor arguments link beans to their collaborators.
 */
@Component
@Order(30)
public class SpringBeansHandler implements FormatHandler {

  @Override
  public String id() {
    return "spring-beans";
  }

  @Override
  public String displayName() {
    return "Spring Bean Configuration";
  }

  @Override
  public DetectionResult detect(ParsedDocument document) {
    XmlElement root = document.root();
    return DetectionResult.signals()
        .decisive(root.localName().equals("beans"), 0.7, "root is <beans>")
        .decisive(
            document.declaresNamespace("springframework.org/schema"), 1.0, "Spring namespace")
        .add(!root.children("bean").isEmpty(), 0.1, "declares <bean> elements")
        .result();
  }

  @Override
  public void extract(ParsedDocument document, SummaryRecord.Builder summary) {
    XmlElement root = document.root();
    List<XmlElement> beans = root.children("bean");
    List<String> classes = new ArrayList<>();
    for (XmlElement bean : beans) {
      String beanClass = bean.attribute("class");
      if (beanClass != null && !classes.contains(beanClass)) {
        classes.add(beanClass);
      }
    }
    summary
        .field("beanCount", beans.size())
        .field("beanClasses", classes)
        .field("defaultAutowire", root.attribute("default-autowire"))
        .field("profile", root.attribute("profile"))
        .field("imports", root.values("import/@resource"))
        .field("componentScan", root.values("component-scan/@base-package"));

    summary
        .boundary("beans/bean", "bean", "@id")
        .reference("beans/bean", "property/@ref", "property")
        .reference("beans/bean", "constructor-arg/@ref", "constructor-arg");
  }
}
