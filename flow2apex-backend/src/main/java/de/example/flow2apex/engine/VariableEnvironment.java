package de.example.flow2apex.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Names known to one transpile run: declared types, loop variables and formula
 * functions. Entries are never removed.
 */
public final class VariableEnvironment {
  private static final String LIST_PREFIX = "List<";

  private final Map<String, String> types = new LinkedHashMap<>();
  private final Map<String, String> loopVariables = new LinkedHashMap<>();
  private final Map<String, String> functions = new LinkedHashMap<>();

  public void declare(String name, String type) {
    types.put(name, type);
  }

  public Optional<String> typeOf(String name) {
    return Optional.ofNullable(types.get(name));
  }

  public void declareLoopVariable(String loopName, String varName) {
    loopVariables.put(loopName, varName);
  }

  public Optional<String> loopVariableOf(String loopName) {
    return Optional.ofNullable(loopVariables.get(loopName));
  }

  /** Reverse lookup; when several loops share a variable the most recently declared loop wins. */
  public Optional<String> loopNameOf(String varName) {
    List<Map.Entry<String, String>> entries = new ArrayList<>(loopVariables.entrySet());
    for (int i = entries.size() - 1; i >= 0; i--) {
      if (entries.get(i).getValue().equals(varName)) return Optional.of(entries.get(i).getKey());
    }
    return Optional.empty();
  }

  public void declareFunction(String name, String functionName) {
    functions.put(name, functionName);
  }

  public Optional<String> functionOf(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public boolean isList(String name) {
    return typeOf(name).map(t -> t.startsWith(LIST_PREFIX)).orElse(false);
  }

  /** {@code List<Account>} -> {@code Account}; non-list types come back unchanged. */
  public static String elementType(String type) {
    if (type != null && type.startsWith(LIST_PREFIX) && type.endsWith(">")) {
      return type.substring(LIST_PREFIX.length(), type.length() - 1).trim();
    }
    return type;
  }

  public static String listOf(String type) {
    return LIST_PREFIX + type + ">";
  }
}
