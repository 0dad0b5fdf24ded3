package de.example.flow2apex.parse;

public class FlowParseException extends RuntimeException {

  public FlowParseException(String message) {
    super(message);
  }

  public FlowParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
