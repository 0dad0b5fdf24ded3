package de.example.flow2apex.render;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.engine.ValueResolver;
import de.example.flow2apex.engine.VariableEnvironment;
import de.example.flow2apex.model.ElementMap;

public record RenderContext(
    PseudocodeWriter out,
    ValueResolver resolver,
    VariableEnvironment variables,
    ElementMap elements
) {
}
