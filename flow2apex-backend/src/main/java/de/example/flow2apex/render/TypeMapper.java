package de.example.flow2apex.render;

import de.example.flow2apex.engine.VariableEnvironment;
import de.example.flow2apex.model.FlowVariable;

import java.util.Locale;

/** Flow data types to Apex type names. */
public final class TypeMapper {

  private TypeMapper() {}

  public static String mapToApex(String flowType) {
    if (flowType == null) return "String";
    return switch (flowType.toLowerCase(Locale.ROOT)) {
      case "string", "text", "textarea", "picklist", "multipicklist", "email", "phone", "url", "radiobuttons" -> "String";
      case "number", "currency" -> "Decimal";
      case "boolean", "checkbox" -> "Boolean";
      case "date" -> "Date";
      case "datetime" -> "DateTime";
      case "time" -> "Time";
      case "reference", "lookupfilter" -> "Id";
      case "sobject" -> "SObject";
      case "apex" -> "Object";
      default -> flowType;
    };
  }

  public static String declaredType(FlowVariable v) {
    String base = "SObject".equalsIgnoreCase(v.dataType()) && v.objectType().isPresent()
        ? v.objectType().get()
        : mapToApex(v.dataType());
    return v.isCollection() ? VariableEnvironment.listOf(base) : base;
  }
}
