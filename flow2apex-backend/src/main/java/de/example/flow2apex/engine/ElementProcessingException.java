package de.example.flow2apex.engine;

/**
 * Recoverable error of a single node. The engine turns it into an inline
 * {@code // ERROR:} comment and keeps going.
 */
public class ElementProcessingException extends RuntimeException {
  private final String elementName;
  private final String reason;

  public ElementProcessingException(String elementName, String reason) {
    super("Error processing element '" + elementName + "': " + reason);
    this.elementName = elementName;
    this.reason = reason;
  }

  public String elementName() {
    return elementName;
  }

  public String reason() {
    return reason;
  }
}
