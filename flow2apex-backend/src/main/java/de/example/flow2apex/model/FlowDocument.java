package de.example.flow2apex.model;

import java.util.List;
import java.util.Optional;

/** A parsed Flow: header metadata, declared variables, the start node and all other elements. */
public record FlowDocument(
    String label,
    String processType,
    String status,
    Optional<String> description,
    List<FlowVariable> variables,
    FlowElement start,
    ElementMap elements
) {

  public FlowDocument {
    variables = List.copyOf(variables);
  }
}
