package de.example.flow2apex.render;

import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class RecordCreateRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    Optional<String> input = element.text("inputReference");
    if (input.isPresent()) {
      ctx.out().line("insert " + ctx.resolver().resolve(input.get()) + ";");
      return;
    }

    String object = element.text("object").orElse("SObject");
    String var = element.text("outputReference").orElse("newRecord");
    ctx.variables().declare(var, object);

    List<XmlNode> assignments = element.node().children("inputAssignments");
    if (assignments.isEmpty()) {
      ctx.out().line(object + " " + var + " = new " + object + "();");
      ctx.out().line("insert " + var + ";");
      return;
    }

    List<String> fields = new ArrayList<>();
    int invalid = 0;
    for (XmlNode a : assignments) {
      Optional<String> field = a.text("field");
      Optional<String> value = a.child("value").flatMap(v -> FlowValues.literalOrReference(v, ctx.resolver(), '\''));
      if (field.isPresent() && value.isPresent()) fields.add(field.get() + " = " + value.get());
      else invalid++;
    }

    ctx.out().line(object + " " + var + " = new " + object + "(");
    final int errors = invalid;
    ctx.out().indent(() -> {
      for (int i = 0; i < errors; i++) ctx.out().comment("ERROR: Invalid field assignment found");
      for (int i = 0; i < fields.size(); i++) {
        ctx.out().line(fields.get(i) + (i < fields.size() - 1 ? "," : ""));
      }
    });
    ctx.out().line(");");
    ctx.out().line("insert " + var + ";");
  }
}
