package de.example.flow2apex.render;

import de.example.flow2apex.engine.ElementProcessingException;
import de.example.flow2apex.engine.OperatorTable;
import de.example.flow2apex.engine.VariableEnvironment;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Record lookups become an inline SOQL query assigned to the lookup's output variable. */
public final class RecordLookupRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    String object = element.text("object")
        .orElseThrow(() -> new ElementProcessingException(element.name(), "Missing required object type"));
    String output = outputName(element);
    String type = resultType(element).orElse(object);
    ctx.variables().declare(output, type);

    List<String> fields = new ArrayList<>();
    for (XmlNode f : element.node().children("queriedFields")) {
      if (!f.text().isEmpty()) fields.add(f.text());
    }
    if (fields.isEmpty()) fields.add("Id");

    List<String> filters = new ArrayList<>();
    for (XmlNode f : element.node().children("filters")) {
      filter(f, ctx).ifPresent(filters::add);
    }

    ctx.out().line(type + " " + output + " = [");
    ctx.out().indent(() -> {
      ctx.out().line("SELECT " + String.join(", ", fields));
      ctx.out().line("FROM " + object);
      if (!filters.isEmpty()) ctx.out().line("WHERE " + String.join(" AND ", filters));
      if (element.node().flag("getFirstRecordOnly")) ctx.out().line("LIMIT 1");
    });
    ctx.out().line("];");

    for (XmlNode a : element.node().children("outputAssignments")) {
      Optional<String> ref = a.text("assignToReference");
      Optional<String> field = a.text("field");
      if (ref.isPresent() && field.isPresent()) {
        ctx.out().line(ctx.resolver().resolve(ref.get()) + " = " + output + "." + field.get() + ";");
      }
    }
  }

  public static String outputName(FlowElement element) {
    return element.text("outputReference").orElse(element.name());
  }

  /** {@code Obj} for first-record-only lookups, {@code List<Obj>} otherwise; empty without an object. */
  public static Optional<String> resultType(FlowElement element) {
    return element.text("object").map(o -> element.node().flag("getFirstRecordOnly") ? o : VariableEnvironment.listOf(o));
  }

  private static Optional<String> filter(XmlNode f, RenderContext ctx) {
    Optional<String> field = f.text("field");
    Optional<XmlNode> value = f.child("value");
    if (field.isEmpty() || value.isEmpty()) return Optional.empty();
    String op = f.text("operator", "EqualTo");

    Optional<String> ref = value.get().text("elementReference");
    if (ref.isPresent()) {
      return Optional.of(OperatorTable.soql(field.get(), op, null, ctx.resolver().resolve(ref.get())));
    }
    return FlowValues.literal(value.get()).map(lit -> OperatorTable.soql(field.get(), op, lit, null));
  }
}
