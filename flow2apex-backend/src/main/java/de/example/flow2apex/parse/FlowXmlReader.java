package de.example.flow2apex.parse;

import de.example.flow2apex.engine.FlowTranspileException;
import de.example.flow2apex.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads Salesforce Flow metadata XML into a {@link FlowDocument}.
 * Stateless; every call builds its own element ids.
 */
public final class FlowXmlReader {
  private static final Logger log = LoggerFactory.getLogger(FlowXmlReader.class);

  public FlowDocument read(Path file) {
    try {
      return read(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new FlowParseException("Cannot read flow file " + file + ": " + e.getMessage(), e);
    }
  }

  public FlowDocument read(String xml) {
    XmlNode root = new XmlNode(parse(xml).getDocumentElement());
    if (!"Flow".equals(root.tag())) {
      throw new FlowParseException("Expected <Flow> root element but found <" + root.tag() + ">");
    }

    int[] seq = {0};
    ElementMap elements = new ElementMap();
    FlowElement start = null;

    for (ElementKind kind : ElementKind.values()) {
      for (XmlNode n : root.children(kind.xmlTag())) {
        if (kind == ElementKind.START) {
          if (start == null) start = toElement(kind, n.text("name", "start"), n, seq);
          continue;
        }
        Optional<String> name = n.text("name");
        if (name.isEmpty()) {
          if (kind == ElementKind.DECISION) {
            throw new FlowTranspileException(kind, "Missing required name element");
          }
          log.warn("Skipping {} element without <name>", kind.xmlTag());
          continue;
        }
        elements.add(toElement(kind, name.get(), n, seq));
      }
    }

    if (start == null) throw new FlowTranspileException(ElementKind.START, "Missing required start element");

    return new FlowDocument(
        root.text("label", "Unnamed Flow"),
        root.text("processType", "Unknown"),
        root.text("status", "Unknown"),
        root.text("description"),
        readVariables(root),
        start,
        elements
    );
  }

  // =========================================================
  // Elements
  // =========================================================
  private static FlowElement toElement(ElementKind kind, String name, XmlNode n, int[] seq) {
    String id = n.attribute("id").orElseGet(() -> "#" + (++seq[0]));

    List<Connector> connectors = new ArrayList<>();
    addConnector(connectors, n, "connector", ConnectorKind.NORMAL);
    addConnector(connectors, n, "defaultConnector", ConnectorKind.DEFAULT);
    addConnector(connectors, n, "faultConnector", ConnectorKind.FAULT);
    addConnector(connectors, n, "nextValueConnector", ConnectorKind.NEXT_VALUE);
    addConnector(connectors, n, "noMoreValuesConnector", ConnectorKind.NO_MORE_VALUES);
    for (XmlNode path : n.children("scheduledPaths")) {
      addConnector(connectors, path, "connector", ConnectorKind.SCHEDULED_PATH);
    }

    List<DecisionRule> rules = new ArrayList<>();
    if (kind == ElementKind.DECISION) {
      for (XmlNode r : n.children("rules")) rules.add(readRule(r));
    }
    return new FlowElement(kind, name, id, connectors, rules, n);
  }

  private static void addConnector(List<Connector> out, XmlNode owner, String tag, ConnectorKind kind) {
    readConnector(owner, tag, kind).ifPresent(out::add);
  }

  private static Optional<Connector> readConnector(XmlNode owner, String tag, ConnectorKind kind) {
    Optional<XmlNode> c = owner.child(tag);
    if (c.isEmpty()) return Optional.empty();
    Optional<String> target = c.get().text("targetReference");
    if (target.isEmpty()) {
      log.warn("Ignoring <{}> without targetReference", tag);
      return Optional.empty();
    }
    return Optional.of(new Connector(target.get(), c.get().flag("isGoTo"), kind));
  }

  private static DecisionRule readRule(XmlNode r) {
    String name = r.text("name", "UnnamedRule");
    List<Condition> conditions = new ArrayList<>();
    for (XmlNode c : r.children("conditions")) conditions.add(readCondition(c));
    return new DecisionRule(
        name,
        r.text("label", name),
        conditions,
        r.text("conditionLogic", "and"),
        readConnector(r, "connector", ConnectorKind.NORMAL)
    );
  }

  public static Condition readCondition(XmlNode c) {
    return new Condition(
        c.text("leftValueReference").orElse(c.text("field", "unknown")),
        c.text("operator", "EqualTo"),
        c.child("rightValue").or(() -> c.child("value"))
    );
  }

  private static List<FlowVariable> readVariables(XmlNode root) {
    List<FlowVariable> out = new ArrayList<>();
    for (XmlNode v : root.children("variables")) {
      Optional<String> name = v.text("name");
      if (name.isEmpty()) continue;
      out.add(new FlowVariable(name.get(), v.text("dataType", "String"), v.flag("isCollection"), v.text("objectType")));
    }
    return out;
  }

  // =========================================================
  // DOM
  // =========================================================
  private static Document parse(String xml) {
    if (xml == null || xml.isBlank()) throw new FlowParseException("Flow document is empty");
    try {
      DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
      f.setNamespaceAware(true);
      f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      f.setExpandEntityReferences(false);
      DocumentBuilder b = f.newDocumentBuilder();
      b.setErrorHandler(new ErrorHandler() {
        @Override public void warning(SAXParseException e) { log.warn("Flow XML warning: {}", e.getMessage()); }
        @Override public void error(SAXParseException e) throws SAXException { throw e; }
        @Override public void fatalError(SAXParseException e) throws SAXException { throw e; }
      });
      return b.parse(new InputSource(new StringReader(xml.strip())));
    } catch (SAXException e) {
      throw new FlowParseException("Malformed flow XML: " + e.getMessage(), e);
    } catch (ParserConfigurationException | IOException e) {
      throw new FlowParseException("Cannot parse flow XML: " + e.getMessage(), e);
    }
  }
}
