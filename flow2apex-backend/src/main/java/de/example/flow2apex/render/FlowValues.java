package de.example.flow2apex.render;

import de.example.flow2apex.engine.ValueResolver;
import de.example.flow2apex.model.XmlNode;

import java.util.Locale;
import java.util.Optional;

/** Reads the typed {@code <value>} payload Flow uses for parameters, assignments and filters. */
public final class FlowValues {

  private FlowValues() {}

  /**
   * Element references go through {@code resolver}; strings and dates are wrapped in
   * {@code quote}; booleans are lowercased; numbers stay as written.
   */
  public static Optional<String> literalOrReference(XmlNode value, ValueResolver resolver, char quote) {
    Optional<String> ref = value.text("elementReference");
    if (ref.isPresent()) return Optional.of(resolver.resolve(ref.get()));

    Optional<XmlNode> str = value.child("stringValue");
    if (str.isPresent()) return Optional.of(quote + str.get().text() + quote);

    Optional<String> bool = value.text("booleanValue");
    if (bool.isPresent()) return Optional.of(bool.get().toLowerCase(Locale.ROOT));

    Optional<String> num = value.text("numberValue");
    if (num.isPresent()) return num;

    return value.text("dateValue").or(() -> value.text("dateTimeValue")).map(d -> quote + d + quote);
  }

  /** Unquoted literal text, or empty when the value is a reference or missing. */
  public static Optional<String> literal(XmlNode value) {
    Optional<XmlNode> str = value.child("stringValue");
    if (str.isPresent()) return Optional.of(str.get().text());
    return value.text("booleanValue")
        .or(() -> value.text("numberValue"))
        .or(() -> value.text("dateValue"))
        .or(() -> value.text("dateTimeValue"));
  }
}
