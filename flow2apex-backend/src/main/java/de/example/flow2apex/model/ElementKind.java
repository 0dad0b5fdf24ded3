package de.example.flow2apex.model;

import java.util.Locale;

/** Node kinds of a Flow, keyed by their metadata XML tag. */
public enum ElementKind {
  START("start"),
  DECISION("decisions"),
  LOOP("loops"),
  ACTION_CALL("actionCalls"),
  RECORD_LOOKUP("recordLookups"),
  RECORD_CREATE("recordCreates"),
  RECORD_UPDATE("recordUpdates"),
  ASSIGNMENT("assignments"),
  FORMULA("formulas"),
  SCREEN("screens"),
  SUBFLOW("subflows"),
  TEXT_TEMPLATE("textTemplates"),
  VARIABLE("variables");

  private final String xmlTag;

  ElementKind(String xmlTag) {
    this.xmlTag = xmlTag;
  }

  public String xmlTag() {
    return xmlTag;
  }

  /** Lowercase name used in diagnostics ("record lookup", "decision", ...). */
  public String displayName() {
    return name().toLowerCase(Locale.ROOT).replace('_', ' ');
  }
}
