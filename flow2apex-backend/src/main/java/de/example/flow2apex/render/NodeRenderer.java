package de.example.flow2apex.render;

import de.example.flow2apex.model.FlowElement;

/**
 * Emits the statements of one linear (non-branching) element. Renderers write only
 * through {@link RenderContext#out()} and may throw
 * {@link de.example.flow2apex.engine.ElementProcessingException} for recoverable problems.
 */
@FunctionalInterface
public interface NodeRenderer {
  void render(FlowElement element, RenderContext ctx);
}
