package de.example.flow2apex.engine;

import de.example.flow2apex.model.Connector;
import de.example.flow2apex.model.ConnectorKind;
import de.example.flow2apex.model.DecisionRule;
import de.example.flow2apex.model.FlowElement;

import java.util.LinkedHashSet;
import java.util.Set;

/** Pre-scan for names reached through goto-marked connectors. Fault edges never count. */
public final class GotoTargets {

  private GotoTargets() {}

  public static Set<String> scan(Iterable<FlowElement> elements) {
    Set<String> out = new LinkedHashSet<>();
    for (FlowElement e : elements) {
      for (Connector c : e.connectors()) add(out, c);
      for (DecisionRule r : e.rules()) r.connector().ifPresent(c -> add(out, c));
    }
    return out;
  }

  private static void add(Set<String> out, Connector c) {
    if (c.isGoto() && c.kind() != ConnectorKind.FAULT) out.add(c.targetName());
  }
}
