package de.example.flow2apex.render;

import static de.example.flow2apex.FlowFixtures.parse;
import static de.example.flow2apex.FlowFixtures.start;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.engine.LoopContextStack;
import de.example.flow2apex.engine.ReferenceResolver;
import de.example.flow2apex.engine.VariableEnvironment;
import de.example.flow2apex.model.FlowDocument;
import de.example.flow2apex.model.FlowElement;

/** Runs a single renderer over an element parsed from a snippet. */
final class RenderHarness {
  final PseudocodeWriter out = new PseudocodeWriter();
  final VariableEnvironment env = new VariableEnvironment();
  final LoopContextStack loops = new LoopContextStack();
  final ReferenceResolver references = new ReferenceResolver(loops, env);

  /** Renders {@code name} from {@code elementsXml} and returns the output. */
  String render(NodeRenderer renderer, String name, String... elementsXml) {
    FlowDocument doc = parse(start(null, name), elementsXml);
    FlowElement element = doc.elements().find(name).orElseThrow();
    renderer.render(element, new RenderContext(out, references.forElement(name), env, doc.elements()));
    return out.render();
  }
}
