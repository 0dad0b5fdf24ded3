package de.example.flow2apex.render;

import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.List;
import java.util.Optional;

public final class RecordUpdateRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    List<XmlNode> assignments = element.node().children("inputAssignments");
    String target = element.text("inputReference").map(ctx.resolver()::resolve).orElse("recordToUpdate");

    if (assignments.isEmpty()) {
      if (element.text("inputReference").isPresent()) {
        ctx.out().line("update " + target + ";");
      } else {
        ctx.out().comment("ERROR: No field assignments found in record update");
      }
      return;
    }

    for (XmlNode a : assignments) {
      Optional<String> field = a.text("field");
      Optional<String> value = a.child("value").flatMap(v -> FlowValues.literalOrReference(v, ctx.resolver(), '\''));
      if (field.isEmpty() || value.isEmpty()) {
        ctx.out().comment("ERROR: Invalid field assignment found");
        continue;
      }
      ctx.out().line(target + "." + field.get() + " = " + value.get() + ";");
    }
    ctx.out().line("update " + target + ";");
  }
}
