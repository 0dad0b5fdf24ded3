package de.example.flow2apex.engine;

import de.example.flow2apex.model.ElementKind;

/** Fatal structural error: the rest of the document cannot be attributed to any node. */
public class FlowTranspileException extends RuntimeException {
  private final ElementKind elementKind;

  public FlowTranspileException(ElementKind elementKind, String message) {
    super("Fatal error in " + elementKind.displayName() + ": " + message);
    this.elementKind = elementKind;
  }

  public ElementKind elementKind() {
    return elementKind;
  }
}
