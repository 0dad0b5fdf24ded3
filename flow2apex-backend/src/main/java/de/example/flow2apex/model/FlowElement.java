package de.example.flow2apex.model;

import java.util.List;
import java.util.Optional;

/**
 * A node of the Flow graph. {@code id} is unique per parsed document and is what
 * cycle detection keys on; {@code name} is the cross-reference key used by connectors.
 */
public final class FlowElement {
  private final ElementKind kind;
  private final String name;
  private final String id;
  private final List<Connector> connectors;
  private final List<DecisionRule> rules;
  private final XmlNode node;

  public FlowElement(ElementKind kind, String name, String id, List<Connector> connectors,
                     List<DecisionRule> rules, XmlNode node) {
    this.kind = kind;
    this.name = name;
    this.id = id;
    this.connectors = List.copyOf(connectors);
    this.rules = List.copyOf(rules);
    this.node = node;
  }

  public ElementKind kind() { return kind; }
  public String name() { return name; }
  public String id() { return id; }
  public List<Connector> connectors() { return connectors; }
  public List<DecisionRule> rules() { return rules; }
  public XmlNode node() { return node; }

  public Optional<Connector> connector(ConnectorKind k) {
    for (Connector c : connectors) {
      if (c.kind() == k) return Optional.of(c);
    }
    return Optional.empty();
  }

  public Optional<String> description() {
    return node.text("description");
  }

  /** Convenience for renderers: text of a direct child tag. */
  public Optional<String> text(String tag) {
    return node.text(tag);
  }

  @Override
  public String toString() {
    return kind.xmlTag() + ":" + name;
  }
}
