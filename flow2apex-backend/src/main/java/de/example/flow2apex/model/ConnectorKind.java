package de.example.flow2apex.model;

public enum ConnectorKind {
  NORMAL,
  DEFAULT,
  FAULT,
  NEXT_VALUE,
  NO_MORE_VALUES,
  SCHEDULED_PATH
}
