package de.example.flow2apex.engine;

import java.util.Optional;

/** Flow comparison operators and how they read in generated Apex and SOQL. */
public final class OperatorTable {

  private OperatorTable() {}

  public static String symbol(String operator) {
    return switch (operator) {
      case "EqualTo" -> "==";
      case "NotEqualTo" -> "!=";
      case "GreaterThan" -> ">";
      case "LessThan" -> "<";
      case "GreaterThanOrEqualTo" -> ">=";
      case "LessThanOrEqualTo" -> "<=";
      case "Contains", "Includes" -> ".contains";
      case "StartsWith" -> ".startsWith";
      case "EndsWith" -> ".endsWith";
      case "Excludes" -> "!contains";
      case "IsNull" -> "== null";
      case "IsNotNull" -> "!= null";
      case "IsChanged" -> "!=";
      case "IsNew" -> ".isNew()";
      case "IsDeleted" -> ".isDeleted()";
      default -> operator;
    };
  }

  /** Boolean expression for {@code left <operator> right}. */
  public static String format(String left, String operator, String right) {
    return switch (operator) {
      case "IsNull" -> "false".equals(right) ? left + " != null" : left + " == null";
      case "IsNotNull" -> left + " != null";
      case "IsChanged" -> priorOf(left)
          .map(prior -> left + " != " + prior)
          .orElse("false /* ERROR: No prior value for " + left + " */");
      case "IsNew", "IsDeleted" -> left + symbol(operator);
      case "Excludes" -> "!" + left + ".contains(" + right + ")";
      case "Contains", "Includes", "StartsWith", "EndsWith" -> left + symbol(operator) + "(" + right + ")";
      default -> left + " " + symbol(operator) + " " + right;
    };
  }

  /** {@code record.X} -> {@code oldRecord.X}; empty for anything not read from the triggering record. */
  public static Optional<String> priorOf(String recordReference) {
    return recordReference.startsWith("record.")
        ? Optional.of("oldRecord." + recordReference.substring("record.".length()))
        : Optional.empty();
  }

  /**
   * SOQL filter. {@code literal} is the raw literal text or null, {@code reference}
   * the resolved bind expression when the value points at a variable.
   */
  public static String soql(String field, String operator, String literal, String reference) {
    if (reference != null) return field + " " + soqlSymbol(operator) + " " + reference;
    String v = literal == null ? "" : literal;
    return switch (operator) {
      case "Contains" -> field + " LIKE '%" + v + "%'";
      case "StartsWith" -> field + " LIKE '" + v + "%'";
      case "EndsWith" -> field + " LIKE '%" + v + "'";
      case "IsNull" -> "false".equalsIgnoreCase(v) ? field + " != null" : field + " = null";
      default -> {
        String rendered = v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")
            ? v.toLowerCase()
            : "'" + v + "'";
        yield field + " " + soqlSymbol(operator) + " " + rendered;
      }
    };
  }

  public static String soqlSymbol(String operator) {
    String s = symbol(operator);
    return "==".equals(s) ? "=" : s;
  }
}
