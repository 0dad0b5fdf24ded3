package de.example.flow2apex.render;

import de.example.flow2apex.engine.ElementProcessingException;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.List;
import java.util.Optional;

public final class AssignmentRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    List<XmlNode> items = element.node().children("assignmentItems");
    if (items.isEmpty()) throw new ElementProcessingException(element.name(), "No assignment items found");

    for (XmlNode item : items) {
      Optional<String> rawTarget = item.text("assignToReference");
      if (rawTarget.isEmpty()) {
        ctx.out().comment("ERROR: Assignment item without assignToReference");
        continue;
      }
      String target = ctx.resolver().resolve(rawTarget.get());
      String value = item.child("value")
          .flatMap(v -> FlowValues.literalOrReference(v, ctx.resolver(), '\''))
          .orElse("null");
      String op = item.text("operator", "Assign");
      ctx.out().line(statement(target, op, value, isCollection(rawTarget.get(), ctx)));
    }
  }

  static String statement(String target, String operator, String value, boolean collection) {
    return switch (operator) {
      case "Add" -> collection ? target + ".add(" + value + ");" : target + " += " + value + ";";
      case "Subtract" -> target + " -= " + value + ";";
      case "AddItem" -> target + ".add(" + value + ");";
      case "AddAtStart" -> target + ".add(0, " + value + ");";
      case "RemoveAll" -> target + ".removeAll(" + value + ");";
      case "RemoveFirst" -> target + ".remove(" + target + ".indexOf(" + value + "));";
      default -> target + " = " + value + ";";
    };
  }

  private static boolean isCollection(String rawTarget, RenderContext ctx) {
    if (ctx.variables().isList(rawTarget)) return true;
    return rawTarget.endsWith("List") || rawTarget.endsWith("Collection");
  }
}
