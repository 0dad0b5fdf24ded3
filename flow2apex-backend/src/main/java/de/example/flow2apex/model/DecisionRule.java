package de.example.flow2apex.model;

import java.util.List;
import java.util.Optional;

public record DecisionRule(
    String name,
    String label,
    List<Condition> conditions,
    String conditionLogic,
    Optional<Connector> connector
) {

  public DecisionRule {
    conditions = List.copyOf(conditions);
  }

  public boolean hasConditions() {
    return !conditions.isEmpty();
  }
}
