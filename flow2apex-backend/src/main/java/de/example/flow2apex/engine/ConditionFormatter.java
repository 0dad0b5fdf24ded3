package de.example.flow2apex.engine;

import de.example.flow2apex.model.Condition;
import de.example.flow2apex.render.FlowValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ConditionFormatter {
  private static final Pattern LOGIC_TOKEN = Pattern.compile("\\d+|(?i:AND|OR|NOT)|\\(|\\)");

  private ConditionFormatter() {}

  public static String format(Condition c, ValueResolver resolver) {
    String left = resolver.resolve(c.leftReference());
    String right = c.rightValue().flatMap(v -> FlowValues.literalOrReference(v, resolver, '\'')).orElse("null");
    return OperatorTable.format(left, c.operator(), right);
  }

  /**
   * Joins conditions per {@code logic}: "and", "or", or a custom expression such as
   * {@code 1 AND (2 OR NOT 3)} whose numbers are 1-based condition indexes.
   */
  public static String formatAll(List<Condition> conditions, String logic, ValueResolver resolver) {
    List<String> parts = new ArrayList<>();
    for (Condition c : conditions) parts.add(format(c, resolver));
    return join(parts, logic);
  }

  /** Joins already formatted conditions by {@code logic}. */
  public static String join(List<String> parts, String logic) {
    if (parts.isEmpty()) return "true";
    if (parts.size() == 1) return parts.get(0);

    String l = logic == null ? "and" : logic.trim().toLowerCase(Locale.ROOT);
    if (l.isEmpty() || l.equals("and")) return String.join(" && ", parts);
    if (l.equals("or")) return String.join(" || ", parts);
    return applyCustomLogic(logic, parts);
  }

  private static String applyCustomLogic(String logic, List<String> parts) {
    StringBuilder sb = new StringBuilder();
    Matcher m = LOGIC_TOKEN.matcher(logic);
    while (m.find()) {
      String t = m.group();
      String piece = switch (t.toUpperCase(Locale.ROOT)) {
        case "AND" -> " && ";
        case "OR" -> " || ";
        case "NOT" -> "!";
        case "(", ")" -> t;
        default -> {
          // longer than any int, so never a valid index
          int idx = t.length() > 9 ? -1 : Integer.parseInt(t) - 1;
          yield idx >= 0 && idx < parts.size() ? "(" + parts.get(idx) + ")" : "/* unknown condition " + t + " */";
        }
      };
      sb.append(piece);
    }
    return sb.toString().replace("( ", "(").replace(" )", ")").trim();
  }
}
