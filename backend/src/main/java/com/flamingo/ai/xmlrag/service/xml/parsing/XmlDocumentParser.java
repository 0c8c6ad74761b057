package com.flamingo.ai.xmlrag.service.xml.parsing;

import com.flamingo.ai.xmlrag.config.XmlRagConfig;
import com.flamingo.ai.xmlrag.exception.MalformedInputException;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses raw XML bytes into an immutable {@link ParsedDocument}.
 *
 * <p>Uses a namespace-aware JDK DOM parser hardened against entity expansion: DOCTYPE
 * declarations, external entities and XInclude are all refused, and element nesting is capped
 * at {@code xmlrag.parsing.max-element-depth} levels. The DOM is then copied into {@link
 * XmlElement} nodes carrying their path, depth and document position, and discarded.
 *
 * <p>Stateless; a new {@link DocumentBuilder} is created per call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class XmlDocumentParser {

  static final String MAX_ELEMENT_DEPTH_PROPERTY =
      "http://www.oracle.com/xml/jaxp/properties/maxElementDepth";

  private final XmlRagConfig config;

  /**
   * Parses the given bytes.
   *
   * @param bytes raw XML; the encoding is taken from the XML declaration (UTF-8 by default)
   * @return parsed document
   * @throws MalformedInputException if the input is empty, too large, nested too deeply or not
   *     well-formed
   */
  public ParsedDocument parse(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new MalformedInputException("Input is empty");
    }
    long limit = config.getParsing().getMaxDocumentBytes();
    if (limit > 0 && bytes.length > limit) {
      throw new MalformedInputException(
          String.format("Input of %d bytes exceeds the limit of %d bytes", bytes.length, limit));
    }

    int depthLimit = config.getParsing().getMaxElementDepth();
    org.w3c.dom.Document dom;
    try {
      DocumentBuilder builder = newDocumentBuilder(depthLimit);
      dom = builder.parse(new ByteArrayInputStream(bytes));
    } catch (SAXException e) {
      log.debug("Rejected malformed XML input: {}", e.getMessage());
      throw new MalformedInputException("Failed to parse XML: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new MalformedInputException("Failed to read XML input: " + e.getMessage(), e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser is not configurable", e);
    }

    Map<String, String> namespaces = new LinkedHashMap<>();
    int[] position = {0};
    XmlElement root =
        convert(dom.getDocumentElement(), "", 0, -1, position, namespaces, depthLimit);
    ParsedDocument document = new ParsedDocument(root, namespaces);
    log.debug(
        "Parsed XML document: root={}, elements={}, maxDepth={}",
        root.qualifiedName(),
        document.elementCount(),
        document.maxDepth());
    return document;
  }

  public ParsedDocument parse(String xml) {
    if (xml == null) {
      throw new MalformedInputException("Input is empty");
    }
    return parse(xml.getBytes(StandardCharsets.UTF_8));
  }

  // ---- private helpers ----

  private DocumentBuilder newDocumentBuilder(int depthLimit) throws ParserConfigurationException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
    dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    dbf.setXIncludeAware(false);
    dbf.setExpandEntityReferences(false);
    dbf.setNamespaceAware(true);
    dbf.setCoalescing(true);
    dbf.setIgnoringComments(true);
    if (depthLimit > 0) {
      try {
        dbf.setAttribute(MAX_ELEMENT_DEPTH_PROPERTY, String.valueOf(depthLimit));
      } catch (IllegalArgumentException e) {
        // the limit is still enforced while the DOM is copied
        log.debug(
            "DOM parser does not support {}: {}", MAX_ELEMENT_DEPTH_PROPERTY, e.getMessage());
      }
    }
    DocumentBuilder builder = dbf.newDocumentBuilder();
    builder.setErrorHandler(new RethrowingErrorHandler());
    return builder;
  }

  private XmlElement convert(
      Element el,
      String parentPath,
      int depth,
      int parentPosition,
      int[] position,
      Map<String, String> namespaces,
      int depthLimit) {

    if (depthLimit > 0 && depth >= depthLimit) {
      throw new MalformedInputException(
          String.format(
              "Element <%s> is nested deeper than the limit of %d levels",
              el.getTagName(), depthLimit));
    }
    int myPosition = position[0]++;
    String localName = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    String path = parentPath.isEmpty() ? localName : parentPath + "/" + localName;

    Map<String, String> attributes = new LinkedHashMap<>();
    NamedNodeMap attrs = el.getAttributes();
    for (int i = 0; i < attrs.getLength(); i++) {
      Attr attr = (Attr) attrs.item(i);
      String name = attr.getName();
      if ("xmlns".equals(name)) {
        namespaces.putIfAbsent("default", attr.getValue());
      } else if (name.startsWith("xmlns:")) {
        namespaces.putIfAbsent(name.substring(6), attr.getValue());
      } else {
        attributes.put(name, attr.getValue());
      }
    }

    StringBuilder text = new StringBuilder();
    List<XmlElement> children = new ArrayList<>();
    NodeList nodes = el.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      switch (node.getNodeType()) {
        case Node.ELEMENT_NODE ->
            children.add(
                convert(
                    (Element) node,
                    path,
                    depth + 1,
                    myPosition,
                    position,
                    namespaces,
                    depthLimit));
        case Node.TEXT_NODE, Node.CDATA_SECTION_NODE ->
            text.append(' ').append(node.getNodeValue());
        default -> {
          // processing instructions and comments carry no content
        }
      }
    }

    return new XmlElement(
        localName,
        el.getNamespaceURI(),
        el.getPrefix(),
        attributes,
        normalizeWhitespace(text),
        children,
        path,
        depth,
        myPosition,
        parentPosition);
  }

  private static String normalizeWhitespace(CharSequence raw) {
    return raw.toString().replaceAll("\\s+", " ").trim();
  }

  /** Turns warnings into nothing and every error into a parse failure. */
  private static final class RethrowingErrorHandler implements ErrorHandler {

    @Override
    public void warning(SAXParseException exception) {
      log.debug("XML parser warning: {}", exception.getMessage());
    }

    @Override
    public void error(SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(SAXParseException exception) throws SAXException {
      throw exception;
    }
  }
}
