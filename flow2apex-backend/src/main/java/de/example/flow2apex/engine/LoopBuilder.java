package de.example.flow2apex.engine;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.emit.Scope;
import de.example.flow2apex.model.Connector;
import de.example.flow2apex.model.ConnectorKind;
import de.example.flow2apex.model.ElementKind;
import de.example.flow2apex.model.ElementMap;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.render.RecordLookupRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/** for-each header, body under a pushed loop context, then the after-loop chain. */
public final class LoopBuilder {
  private static final Logger log = LoggerFactory.getLogger(LoopBuilder.class);
  static final String UNTYPED = "SObject";

  private final PseudocodeWriter out;
  private final VariableEnvironment env;
  private final LoopContextStack loops;
  private final ReferenceResolver references;
  private final ElementMap elements;
  private final Consumer<Connector> follow;

  public LoopBuilder(PseudocodeWriter out, VariableEnvironment env, LoopContextStack loops,
                     ReferenceResolver references, ElementMap elements, Consumer<Connector> follow) {
    this.out = out;
    this.env = env;
    this.loops = loops;
    this.references = references;
    this.elements = elements;
    this.follow = follow;
  }

  public void build(FlowElement loop) {
    Optional<Connector> after = loop.connector(ConnectorKind.NO_MORE_VALUES);
    Optional<String> collection = loop.text("collectionReference");
    if (collection.isEmpty()) {
      log.warn("Loop {} has no collection reference", loop.name());
      out.comment("ERROR: No collection reference found for loop " + loop.name());
      after.ifPresent(follow);
      return;
    }

    String coll = collection.get();
    String var = loopVariable(coll);
    String type = elementType(coll);
    String source = resolveCollection(coll, loop.name());
    env.declareLoopVariable(loop.name(), var);

    out.line("for (" + type + " " + var + " : " + source + ") {");
    try (Scope indent = out.openScope();
         Scope ctx = loops.enter(new LoopContext(loop.id(), var, coll))) {
      loop.connector(ConnectorKind.NEXT_VALUE)
          .ifPresentOrElse(follow, () -> out.comment("No loop body defined"));
    }
    out.line("}");

    after.ifPresent(follow);
  }

  /** {@code Linked_Leads} -> {@code l}. */
  public static String loopVariable(String collection) {
    String stripped = collection == null ? "" : collection.replace("_", "").replace("$", "");
    if (stripped.isEmpty()) return "item";
    return stripped.substring(0, 1).toLowerCase(Locale.ROOT);
  }

  String elementType(String collection) {
    Optional<String> known = env.typeOf(collection);
    if (known.isPresent()) return VariableEnvironment.elementType(known.get());

    for (FlowElement lookup : elements.ofKind(ElementKind.RECORD_LOOKUP)) {
      Optional<String> object = lookup.text("object");
      if (object.isPresent() && RecordLookupRenderer.outputName(lookup).equals(collection)) {
        env.declare(collection, VariableEnvironment.listOf(object.get()));
        return object.get();
      }
    }
    return UNTYPED;
  }

  private String resolveCollection(String collection, String loopName) {
    try {
      return references.resolve(collection, loopName);
    } catch (ElementProcessingException e) {
      out.comment("ERROR: " + e.reason());
      return collection;
    }
  }
}
