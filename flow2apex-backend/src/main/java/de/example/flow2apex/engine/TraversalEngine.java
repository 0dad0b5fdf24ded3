package de.example.flow2apex.engine;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.emit.Scope;
import de.example.flow2apex.model.*;
import de.example.flow2apex.render.NodeRenderer;
import de.example.flow2apex.render.RecordLookupRenderer;
import de.example.flow2apex.render.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Depth-first walk over the element graph of one run.
 *
 * Every element id is emitted at most once. Reaching the innermost open loop again is
 * its back-edge and ends the branch quietly; reaching any other processed element is a
 * convergence and ends the branch with a log entry. Goto targets are moved into a
 * procedure of their own the first time they are reached and called from there on.
 */
public final class TraversalEngine {
  private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

  private final ElementMap elements;
  private final PseudocodeWriter out;
  private final VariableEnvironment env;
  private final LoopContextStack loops;
  private final ReferenceResolver references;
  private final Map<ElementKind, NodeRenderer> renderers;

  private final DecisionBuilder decisions;
  private final LoopBuilder loopBuilder;
  private final StartBuilder startBuilder;

  private final Set<String> processed = new HashSet<>();
  private final Deque<String> path = new ArrayDeque<>();
  private final Set<String> gotoTargets = new LinkedHashSet<>();
  private final Set<String> promoted = new LinkedHashSet<>();

  private record ProcedureReturn(List<String> names, String type) {
    static final ProcedureReturn NONE = new ProcedureReturn(List.of(), null);

    boolean single() { return names.size() == 1; }
  }

  public TraversalEngine(ElementMap elements, PseudocodeWriter out, VariableEnvironment env,
                         LoopContextStack loops, Map<ElementKind, NodeRenderer> renderers) {
    this.elements = elements;
    this.out = out;
    this.env = env;
    this.loops = loops;
    this.references = new ReferenceResolver(loops, env);
    this.renderers = new EnumMap<>(ElementKind.class);
    this.renderers.putAll(renderers);

    this.decisions = new DecisionBuilder(out, references, this::follow);
    this.loopBuilder = new LoopBuilder(out, env, loops, references, elements, this::follow);
    this.startBuilder = new StartBuilder(out, env, references, this::follow);
  }

  // =========================================================
  // Entry points
  // =========================================================
  /** Scans for goto targets, then emits everything reachable from {@code start}. */
  public void run(FlowElement start) {
    List<FlowElement> all = new ArrayList<>(elements.all());
    all.add(start);
    gotoTargets.addAll(GotoTargets.scan(all));
    if (!gotoTargets.isEmpty()) log.debug("Goto targets: {}", gotoTargets);
    traverse(start);
  }

  /** Emits a linear element without following its connectors; used for up-front declarations. */
  public void emitStandalone(FlowElement element) {
    if (!processed.add(element.id())) return;
    renderLinear(element, false);
  }

  public void traverse(FlowElement element) {
    String id = element.id();
    if (processed.contains(id)) {
      if (loops.isInnermostLoop(id)) {
        log.debug("Loop back-edge to {}", element.name());
      } else {
        log.warn("Element {} already emitted, not following again (path: {})", element.name(), path);
      }
      return;
    }

    processed.add(id);
    log.debug("Emitting {}", element);
    path.addLast(element.name());
    try {
      if (gotoTargets.contains(element.name()) && promoted.add(element.name())) {
        if (promote(element) && isLinear(element.kind())) followContinuation(element);
      } else {
        emitWithContinuation(element);
      }
    } finally {
      path.removeLast();
    }
  }

  // =========================================================
  // Goto promotion
  // =========================================================
  /**
   * Emits only the element itself into its own procedure and calls it from the current
   * position. Connectors are followed by the caller, after the call.
   *
   * @return the dispatch result
   */
  private boolean promote(FlowElement element) {
    log.debug("Promoting {} to a procedure", element.name());
    ProcedureReturn ret = inferReturn(element);
    boolean proceed;
    try (Scope procedure = out.openProcedure(element.name(), ret.single() ? ret.type() : null)) {
      if (ret.names().size() > 1) out.comment("Returns: " + String.join(", ", ret.names()));
      proceed = dispatch(element);
      if (ret.single()) out.line("return " + ret.names().get(0) + ";");
    }
    out.line(element.name() + "();");
    return proceed;
  }

  private ProcedureReturn inferReturn(FlowElement element) {
    if (element.kind() != ElementKind.RECORD_LOOKUP) return ProcedureReturn.NONE;
    Optional<String> output = element.text("outputReference");
    if (output.isEmpty()) return ProcedureReturn.NONE;

    List<String> names = new ArrayList<>();
    names.add(output.get());
    for (XmlNode a : element.node().children("outputAssignments")) {
      a.text("assignToReference").filter(n -> !names.contains(n)).ifPresent(names::add);
    }
    if (names.size() > 1) return new ProcedureReturn(names, null);

    String type = env.typeOf(output.get())
        .or(() -> RecordLookupRenderer.resultType(element))
        .orElse("SObject");
    return new ProcedureReturn(names, type);
  }

  // =========================================================
  // Dispatch
  // =========================================================
  private void emitWithContinuation(FlowElement element) {
    if (dispatch(element) && isLinear(element.kind())) followContinuation(element);
  }

  /** @return false when the element has no behavior and its branch must stop */
  private boolean dispatch(FlowElement element) {
    return switch (element.kind()) {
      case START -> {
        startBuilder.build(element);
        yield true;
      }
      case DECISION -> {
        header("Decision - " + element.name(), element);
        decisions.build(element);
        yield true;
      }
      case LOOP -> {
        header("Loop - " + element.name(), element);
        loopBuilder.build(element);
        yield true;
      }
      case ACTION_CALL, RECORD_LOOKUP, RECORD_CREATE, RECORD_UPDATE, ASSIGNMENT, FORMULA, SCREEN, SUBFLOW ->
          renderLinear(element, true);
      case TEXT_TEMPLATE, VARIABLE -> {
        log.warn("No renderer for {} element {}, stopping branch", element.kind().displayName(), element.name());
        yield false;
      }
    };
  }

  private static boolean isLinear(ElementKind kind) {
    return kind != ElementKind.START && kind != ElementKind.DECISION && kind != ElementKind.LOOP;
  }

  private boolean renderLinear(FlowElement element, boolean withHeader) {
    NodeRenderer renderer = renderers.get(element.kind());
    if (renderer == null) {
      log.warn("No renderer registered for {} element {}, stopping branch", element.kind().displayName(), element.name());
      return false;
    }
    if (withHeader) {
      header(element.kind() == ElementKind.ACTION_CALL ? "Action - " + element.name() : element.name(), element);
    }
    try {
      renderer.render(element, new RenderContext(out, references.forElement(element.name()), env, elements));
    } catch (ElementProcessingException e) {
      log.warn(e.getMessage());
      out.comment("ERROR: " + e.reason());
    }
    return true;
  }

  private void header(String title, FlowElement element) {
    out.paragraph();
    out.comment(title);
    element.description().ifPresent(d -> out.comment("Description: " + d));
  }

  // =========================================================
  // Connectors
  // =========================================================
  private void followContinuation(FlowElement element) {
    Optional<Connector> next = element.connector(ConnectorKind.NORMAL)
        .or(() -> element.connector(ConnectorKind.DEFAULT));
    Optional<Connector> fault = element.connector(ConnectorKind.FAULT);

    if (fault.isEmpty()) {
      next.ifPresent(this::follow);
      return;
    }
    out.line("try {");
    out.indent(() -> next.ifPresent(this::follow));
    out.line("} catch (Exception e) {");
    out.indent(() -> follow(fault.get()));
    out.line("}");
  }

  void follow(Connector connector) {
    String target = connector.targetName();
    Optional<FlowElement> element = elements.find(target);
    if (element.isEmpty()) {
      log.error("Target element {} not found (path: {})", target, path);
      out.comment("ERROR: Target element not found: " + target);
      return;
    }
    if (loops.isInnermostLoop(element.get().id())) {
      log.debug("Loop back-edge to {}", target);
      return;
    }
    if (promoted.contains(target)) {
      out.line(target + "();");
      return;
    }
    traverse(element.get());
  }

  // =========================================================
  // Introspection
  // =========================================================
  public Set<String> gotoTargets() {
    return Collections.unmodifiableSet(gotoTargets);
  }

  public Set<String> promoted() {
    return Collections.unmodifiableSet(promoted);
  }

  public boolean isProcessed(FlowElement element) {
    return processed.contains(element.id());
  }
}
