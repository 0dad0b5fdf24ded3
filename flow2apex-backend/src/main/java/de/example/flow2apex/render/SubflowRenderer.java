package de.example.flow2apex.render;

import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.ArrayList;
import java.util.List;

public final class SubflowRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    String flowName = element.text("flowName").orElse(element.name());
    List<String> params = new ArrayList<>();
    addParams(params, element.node().children("inputParameters"), ctx);
    addParams(params, element.node().children("inputAssignments"), ctx);
    ctx.out().line(flowName + "(" + String.join(", ", params) + ");");
  }

  private static void addParams(List<String> out, List<XmlNode> params, RenderContext ctx) {
    for (XmlNode p : params) {
      String name = p.text("name").orElse(null);
      if (name == null) continue;
      String value = p.child("value")
          .flatMap(v -> FlowValues.literalOrReference(v, ctx.resolver(), '"'))
          .orElse("null");
      out.add(name + ": " + value);
    }
  }
}
