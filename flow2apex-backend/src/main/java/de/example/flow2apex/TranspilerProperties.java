package de.example.flow2apex;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param maxInputLength largest request body the REST endpoint accepts, in characters
 * @param indentWidth    spaces per indentation level in generated code
 */
@ConfigurationProperties(prefix = "flow2apex")
public record TranspilerProperties(
    @DefaultValue("500000") int maxInputLength,
    @DefaultValue("4") int indentWidth
) {
}
