package de.example.flow2apex.render;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.engine.ElementProcessingException;
import de.example.flow2apex.engine.ValueResolver;
import de.example.flow2apex.model.FlowElement;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formulas become static getters. {@code CASE(x, a, r1, b, r2, d)} is turned into a
 * {@code switch on} block; everything else is returned as a single expression.
 */
public final class FormulaRenderer implements NodeRenderer {
  private static final Pattern MERGE_FIELD = Pattern.compile("\\{!([^}]*)}");

  @Override
  public void render(FlowElement element, RenderContext ctx) {
    String dataType = element.text("dataType")
        .orElseThrow(() -> new ElementProcessingException(element.name(), "Missing required data type"));
    String expression = element.text("expression")
        .orElseThrow(() -> new ElementProcessingException(element.name(), "Missing required expression"));

    String type = TypeMapper.mapToApex(dataType);
    String function = functionName(element.name());
    List<String> caseArgs = caseArguments(element.name(), expression.strip());
    ctx.variables().declare(element.name(), type);

    PseudocodeWriter out = ctx.out();
    out.line("private static " + type + " " + function + "() {");
    out.indent(() -> body(expression.strip(), caseArgs, ctx.resolver(), out));
    out.line("}");
    out.blank();

    ctx.variables().declareFunction(element.name(), function);
  }

  public static String functionName(String formulaName) {
    return "get" + formulaName;
  }

  /** Arguments of a top-level {@code CASE(...)}; empty when the expression is not one. */
  static List<String> caseArguments(String elementName, String expr) {
    if (!expr.regionMatches(true, 0, "CASE", 0, 4) || !expr.substring(4).stripLeading().startsWith("(")) {
      return List.of();
    }
    int open = expr.indexOf('(');
    int close = expr.lastIndexOf(')');
    if (close < open) {
      throw new ElementProcessingException(elementName, "Unbalanced parentheses in CASE expression");
    }
    return splitArguments(expr.substring(open + 1, close));
  }

  private static void body(String expr, List<String> args, ValueResolver resolver, PseudocodeWriter out) {
    if (args.size() >= 3) {
      out.line("switch on " + mergeFields(args.get(0), resolver) + " {");
      out.indent(() -> {
        int i = 1;
        for (; i + 1 < args.size(); i += 2) {
          out.line("when " + mergeFields(args.get(i), resolver) + " { return " + mergeFields(args.get(i + 1), resolver) + "; }");
        }
        if (i < args.size()) out.line("when else { return " + mergeFields(args.get(i), resolver) + "; }");
      });
      out.line("}");
      out.line("return null;");
      return;
    }
    out.line("return " + mergeFields(expr, resolver) + ";");
  }

  /** {@code {!$Record.Name}} -> {@code record.Name}. */
  static String mergeFields(String text, ValueResolver resolver) {
    Matcher m = MERGE_FIELD.matcher(text.strip());
    StringBuilder sb = new StringBuilder();
    while (m.find()) m.appendReplacement(sb, Matcher.quoteReplacement(resolver.resolve(m.group(1))));
    m.appendTail(sb);
    return sb.toString();
  }

  // top-level commas only; nested calls and quoted strings stay intact
  static List<String> splitArguments(String s) {
    List<String> out = new ArrayList<>();
    int depth = 0;
    char quote = 0;
    StringBuilder cur = new StringBuilder();
    for (char c : s.toCharArray()) {
      if (quote != 0) {
        if (c == quote) quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        out.add(cur.toString().strip());
        cur.setLength(0);
        continue;
      }
      cur.append(c);
    }
    if (!cur.toString().isBlank()) out.add(cur.toString().strip());
    return out;
  }
}
