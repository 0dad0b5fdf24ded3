package de.example.flow2apex.model;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over one DOM element of a Flow document.
 * Child lookups match on local name so the Flow metadata namespace does not matter.
 */
public final class XmlNode {
  private final Element element;

  public XmlNode(Element element) {
    this.element = element;
  }

  public String tag() {
    String local = element.getLocalName();
    return local != null ? local : element.getTagName();
  }

  public Optional<XmlNode> child(String tag) {
    NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node n = nodes.item(i);
      if (n instanceof Element e && tag.equals(localName(e))) return Optional.of(new XmlNode(e));
    }
    return Optional.empty();
  }

  public List<XmlNode> children(String tag) {
    List<XmlNode> out = new ArrayList<>();
    NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node n = nodes.item(i);
      if (n instanceof Element e && tag.equals(localName(e))) out.add(new XmlNode(e));
    }
    return out;
  }

  /** Trimmed text of the first child with the given tag; empty when absent or blank. */
  public Optional<String> text(String tag) {
    return child(tag).map(XmlNode::text).filter(s -> !s.isEmpty());
  }

  public String text(String tag, String fallback) {
    return text(tag).orElse(fallback);
  }

  public String text() {
    String t = element.getTextContent();
    return t == null ? "" : t.trim();
  }

  public boolean flag(String tag) {
    return text(tag).map(s -> s.equalsIgnoreCase("true")).orElse(false);
  }

  public Optional<String> attribute(String name) {
    String v = element.getAttribute(name);
    return v == null || v.isEmpty() ? Optional.empty() : Optional.of(v);
  }

  private static String localName(Element e) {
    String local = e.getLocalName();
    return local != null ? local : e.getTagName();
  }
}
