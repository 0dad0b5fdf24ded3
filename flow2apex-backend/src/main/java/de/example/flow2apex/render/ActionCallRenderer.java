package de.example.flow2apex.render;

import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.ArrayList;
import java.util.List;

public final class ActionCallRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    List<String> args = new ArrayList<>();
    for (XmlNode p : element.node().children("inputParameters")) {
      p.child("value")
          .flatMap(v -> FlowValues.literalOrReference(v, ctx.resolver(), '\''))
          .ifPresent(args::add);
    }
    ctx.out().line(element.name() + "(" + String.join(", ", args) + ");");
  }
}
