package de.example.flow2apex.emit;

public final class ProcedureSignatureBuilder {
  public static final String VOID = "void";

  private ProcedureSignatureBuilder() {}

  public static String buildHeader(String name, String returnType) {
    StringBuilder sb = new StringBuilder();
    sb.append("private ");
    sb.append(isVoid(returnType) ? VOID : returnType.trim());
    sb.append(' ').append(name).append("() {");
    return sb.toString();
  }

  public static boolean isVoid(String returnType) {
    return returnType == null || returnType.isBlank() || VOID.equals(returnType.trim());
  }
}
