package de.example.flow2apex.model;

/** Directed edge to the element called {@code targetName}. */
public record Connector(String targetName, boolean isGoto, ConnectorKind kind) {

  public Connector {
    if (targetName == null || targetName.isBlank()) {
      throw new IllegalArgumentException("Connector target must not be blank");
    }
  }
}
