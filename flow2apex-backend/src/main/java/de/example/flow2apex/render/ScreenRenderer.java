package de.example.flow2apex.render;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.XmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Screens are shown as a constructor call listing their fields, followed by comments
 * describing pre-populated inputs, outputs and where navigation leads.
 */
public final class ScreenRenderer implements NodeRenderer {

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    PseudocodeWriter out = ctx.out();
    String label = element.text("label").orElse(element.name());
    if (!label.equals(element.name())) out.comment("Screen: " + label);

    List<XmlNode> messages = new ArrayList<>();
    List<XmlNode> components = new ArrayList<>();
    List<XmlNode> inputs = new ArrayList<>();
    for (XmlNode f : element.node().children("fields")) {
      Optional<String> type = f.text("fieldType");
      if (type.isEmpty()) continue;
      switch (type.get()) {
        case "DisplayText" -> messages.add(f);
        case "ComponentInstance" -> components.add(f);
        default -> inputs.add(f);
      }
    }

    if (messages.isEmpty() && components.isEmpty() && inputs.isEmpty()) {
      out.line("Screen " + element.name() + " = new Screen();");
    } else {
      out.line("Screen " + element.name() + " = new Screen(");
      out.indent(() -> {
        for (XmlNode m : messages) {
          m.text("fieldText").ifPresent(t -> out.comment("Message: " + cleanMessage(t)));
        }
        for (XmlNode c : components) component(c, out);
        for (int i = 0; i < inputs.size(); i++) inputField(inputs.get(i), i == inputs.size() - 1, out);
      });
      out.line(");");
    }

    parameters("Screen Inputs (Pre-populated values):", element.node().children("inputParameters"), "", out);
    parameters("Screen Outputs (Data flow to next steps):", element.node().children("outputParameters"), ";", out);
    navigation(element, ctx);
  }

  private static void component(XmlNode c, PseudocodeWriter out) {
    Optional<String> name = c.text("name");
    if (name.isEmpty()) return;
    out.comment(name.get() + " Component (" + c.text("extensionName", "Custom Component") + ")");
    List<String> params = new ArrayList<>();
    for (XmlNode p : c.children("inputParameters")) {
      Optional<String> pn = p.text("name");
      Optional<XmlNode> pv = p.child("value");
      if (pn.isPresent() && pv.isPresent()) params.add(pn.get() + ": " + displayValue(pv.get()));
    }
    if (!params.isEmpty()) out.comment("Parameters: " + String.join(", ", params));
  }

  private static void inputField(XmlNode f, boolean last, PseudocodeWriter out) {
    Optional<String> name = f.text("name");
    if (name.isEmpty()) return;

    List<String> parts = new ArrayList<>();
    f.text("fieldText").ifPresent(parts::add);
    String typeInfo = typeInfo(f);
    if (!typeInfo.isEmpty()) parts.add(typeInfo);
    parts.add(f.flag("isRequired") ? "Required" : "Optional");
    f.child("defaultValue").ifPresent(d -> {
      String v = d.child("stringValue").isPresent() || d.child("elementReference").isPresent()
          || d.child("booleanValue").isPresent() || d.child("numberValue").isPresent()
          ? displayValue(d)
          : "\"" + d.text() + "\"";
      if (!v.equals("null") && !v.equals("\"\"")) parts.add("Default: " + v);
    });
    out.comment(String.join(" - ", parts));

    f.text("helpText").ifPresent(h -> out.comment("Help: " + h));
    String validation = validationInfo(f);
    if (!validation.isEmpty()) out.comment("Validation: " + validation);

    String apexType = TypeMapper.mapToApex(f.text("dataType", "String"));
    String visibility = f.text("visibilityRule").map(v -> "Visible when: " + v)
        .orElse("ResetValues".equals(f.text("inputsOnNextNavToAssocScrn", "")) ? "Conditional field" : "User input field");
    out.line(apexType + " " + name.get() + (last ? "" : ",") + " // " + visibility);
  }

  private static String typeInfo(XmlNode f) {
    String fieldType = f.text("fieldType", "");
    return switch (fieldType) {
      case "RadioButtons" -> withChoices("Radio", f);
      case "Picklist", "DropdownBox" -> withChoices("Picklist", f);
      case "MultiSelectPicklist", "MultiSelectCheckboxes", "MultiPicklist" -> withChoices("MultiPicklist", f);
      case "Checkbox" -> "Checkbox";
      default -> f.text("dataType").map(dt -> switch (dt) {
        case "Email" -> "Email format required";
        case "Phone" -> "Phone format";
        case "URL" -> "URL format";
        default -> dt;
      }).orElse(fieldType);
    };
  }

  private static String withChoices(String kind, XmlNode f) {
    List<String> choices = new ArrayList<>();
    for (XmlNode c : f.children("choiceReferences")) {
      if (!c.text().isEmpty()) choices.add("\"" + c.text() + "\"");
    }
    return choices.isEmpty() ? kind : kind + ": [" + String.join(", ", choices) + "]";
  }

  private static String validationInfo(XmlNode f) {
    List<String> parts = new ArrayList<>();
    f.text("scale").ifPresent(s -> parts.add("Scale: " + s));
    String dataType = f.text("dataType", "");
    if (dataType.equals("Text")) parts.add("Max length: 255");
    else if (dataType.equals("TextArea")) parts.add("Max length: 32,768");
    f.child("validationRule").flatMap(v -> v.text("errorMessage").or(() -> Optional.of(v.text())).filter(s -> !s.isEmpty()))
        .ifPresent(r -> parts.add("Rule: " + r));
    return String.join(", ", parts);
  }

  private static void parameters(String title, List<XmlNode> params, String suffix, PseudocodeWriter out) {
    List<String> lines = new ArrayList<>();
    for (XmlNode p : params) {
      Optional<String> name = p.text("name");
      Optional<XmlNode> value = p.child("value");
      if (name.isPresent() && value.isPresent()) lines.add("   " + name.get() + " = " + displayValue(value.get()) + suffix);
    }
    if (lines.isEmpty()) return;
    out.comment(title);
    for (String l : lines) out.comment(l);
  }

  private static void navigation(FlowElement element, RenderContext ctx) {
    List<String> targets = new ArrayList<>();
    navTarget(element.node(), "connector", "Next/Finish", ctx, targets);
    navTarget(element.node(), "faultConnector", "On Error", ctx, targets);
    navTarget(element.node(), "pauseConnector", "On Pause", ctx, targets);
    if (targets.isEmpty()) return;
    ctx.out().comment("Navigation:");
    for (String t : targets) ctx.out().comment("   " + t);
  }

  private static void navTarget(XmlNode node, String tag, String action, RenderContext ctx, List<String> out) {
    node.child(tag).flatMap(c -> c.text("targetReference")).ifPresent(target -> {
      String kind = ctx.elements().find(target).map(e -> " (" + e.kind().xmlTag() + ")").orElse("");
      out.add(action + " -> " + target + kind);
    });
  }

  // screen comments show references as {name}, not resolved code
  private static String displayValue(XmlNode value) {
    Optional<XmlNode> str = value.child("stringValue");
    if (str.isPresent()) return "\"" + str.get().text() + "\"";
    Optional<String> bool = value.text("booleanValue");
    if (bool.isPresent()) return bool.get().toLowerCase();
    Optional<String> num = value.text("numberValue");
    if (num.isPresent()) return num.get();
    return value.text("elementReference").map(r -> "{" + r + "}").orElse("null");
  }

  static String cleanMessage(String message) {
    String m = message.replaceAll("<[^>]*>", "")
        .replaceAll("&lt;[^&]*&gt;", "")
        .replace("&quot;", "\"")
        .replace("&amp;", "&")
        .replace("&lt;", "<")
        .replace("&gt;", ">");
    m = m.replaceAll("\\{!([^}]+)}", "{$1}");
    return m.replaceAll("\\s+", " ").strip();
  }
}
