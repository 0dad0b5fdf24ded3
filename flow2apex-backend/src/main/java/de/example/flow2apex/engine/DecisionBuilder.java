package de.example.flow2apex.engine;

import de.example.flow2apex.emit.CapturedLines;
import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.model.Connector;
import de.example.flow2apex.model.ConnectorKind;
import de.example.flow2apex.model.DecisionRule;
import de.example.flow2apex.model.FlowElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Builds the if / else-if / else chain of a decision.
 *
 * The default branch is rendered into a scratch buffer first; the else block is only
 * written when that produced at least one line, so empty else blocks never appear.
 */
public final class DecisionBuilder {
  private final PseudocodeWriter out;
  private final ReferenceResolver references;
  private final Consumer<Connector> follow;

  public DecisionBuilder(PseudocodeWriter out, ReferenceResolver references, Consumer<Connector> follow) {
    this.out = out;
    this.references = references;
    this.follow = follow;
  }

  public void build(FlowElement decision) {
    ValueResolver resolver = references.forElement(decision.name());

    List<DecisionRule> active = new ArrayList<>();
    for (DecisionRule r : decision.rules()) {
      if (r.hasConditions()) active.add(r);
      else out.comment("ERROR: Decision rule " + r.name() + " has no conditions");
    }

    Optional<Connector> fallback = decision.connector(ConnectorKind.DEFAULT);
    if (active.isEmpty()) {
      fallback.ifPresent(follow);
      return;
    }

    for (int i = 0; i < active.size(); i++) {
      DecisionRule rule = active.get(i);
      out.line((i == 0 ? "if (" : "} else if (") + condition(rule, resolver) + ") {");
      out.indent(() -> rule.connector().ifPresent(follow));
    }

    CapturedLines elseBody = fallback
        .map(c -> out.capture(() -> out.indent(() -> follow.accept(c))))
        .orElse(null);
    if (elseBody != null && !elseBody.isEmpty()) {
      out.line("} else {");
      out.append(elseBody);
    }
    out.line("}");
  }

  private static String condition(DecisionRule rule, ValueResolver resolver) {
    try {
      return ConditionFormatter.formatAll(rule.conditions(), rule.conditionLogic(), resolver);
    } catch (ElementProcessingException e) {
      return "false /* ERROR: " + e.reason() + " */";
    }
  }
}
