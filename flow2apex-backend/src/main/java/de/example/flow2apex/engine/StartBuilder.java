package de.example.flow2apex.engine;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.emit.Scope;
import de.example.flow2apex.model.Connector;
import de.example.flow2apex.model.ConnectorKind;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;
import de.example.flow2apex.render.FlowValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The main sequence only calls {@code processFlow()}; everything reachable from the
 * start node is generated inside that procedure.
 */
public final class StartBuilder {
  public static final String ENTRY_PROCEDURE = "processFlow";

  private final PseudocodeWriter out;
  private final VariableEnvironment env;
  private final ReferenceResolver references;
  private final Consumer<Connector> follow;

  public StartBuilder(PseudocodeWriter out, VariableEnvironment env, ReferenceResolver references,
                      Consumer<Connector> follow) {
    this.out = out;
    this.env = env;
    this.references = references;
    this.follow = follow;
  }

  public void build(FlowElement start) {
    out.line(ENTRY_PROCEDURE + "();");
    out.blank();

    try (Scope procedure = out.openProcedure(ENTRY_PROCEDURE, null)) {
      Optional<String> object = start.text("object");
      if (object.isPresent()) {
        out.line(object.get() + " record = Trigger.new[0];");
        out.line(object.get() + " oldRecord = Trigger.old[0];");
        out.blank();
        env.declare("record", object.get());
        env.declare("oldRecord", object.get());
      }

      Optional<Connector> target = start.connector(ConnectorKind.NORMAL)
          .or(() -> start.connector(ConnectorKind.SCHEDULED_PATH));
      List<XmlNode> filters = start.node().children("filters");
      if (filters.isEmpty()) {
        target.ifPresent(follow);
        return;
      }

      out.line("if (" + filterCondition(start, filters) + ") {");
      out.indent(() -> target.ifPresentOrElse(follow, () -> out.comment("Continue flow processing")));
      out.line("}");
    }
  }

  private String filterCondition(FlowElement start, List<XmlNode> filters) {
    ValueResolver resolver = references.forElement(start.name());
    List<String> parts = new ArrayList<>();
    for (XmlNode f : filters) {
      Optional<String> field = f.text("field");
      if (field.isEmpty()) continue;
      String left = "record." + field.get();
      String op = f.text("operator", "EqualTo");
      Optional<String> right;
      try {
        right = f.child("value").flatMap(v -> FlowValues.literalOrReference(v, resolver, '\''));
      } catch (ElementProcessingException e) {
        parts.add("false /* ERROR: " + e.reason() + " */");
        continue;
      }
      if (right.isEmpty() && op.equals("IsChanged")) {
        parts.add(left + " != oldRecord." + field.get());
      } else {
        parts.add(OperatorTable.format(left, op, right.orElse("true")));
      }
    }
    return ConditionFormatter.join(parts, start.node().text("filterLogic", "and"));
  }
}
