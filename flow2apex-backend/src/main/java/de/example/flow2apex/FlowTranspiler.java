package de.example.flow2apex;

import de.example.flow2apex.emit.PseudocodeWriter;
import de.example.flow2apex.engine.LoopContextStack;
import de.example.flow2apex.engine.TraversalEngine;
import de.example.flow2apex.engine.VariableEnvironment;
import de.example.flow2apex.model.ElementKind;
import de.example.flow2apex.model.FlowDocument;
import de.example.flow2apex.model.FlowElement;
import de.example.flow2apex.model.FlowVariable;
import de.example.flow2apex.parse.FlowXmlReader;
import de.example.flow2apex.render.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Salesforce Flow XML -> Apex-like pseudocode.
 *
 * Thread-safe: the service holds no per-transpile state. Every call builds a fresh
 * {@link Run} with its own output model, environment and loop stack.
 */
@Service
public class FlowTranspiler {
  private static final Logger log = LoggerFactory.getLogger(FlowTranspiler.class);

  private final FlowXmlReader reader = new FlowXmlReader();
  private final Map<ElementKind, NodeRenderer> renderers = defaultRenderers();
  private final int indentWidth;

  public FlowTranspiler() {
    this(4);
  }

  public FlowTranspiler(int indentWidth) {
    this.indentWidth = indentWidth;
  }

  @Autowired
  public FlowTranspiler(TranspilerProperties properties) {
    this(properties.indentWidth());
  }

  // =========================================================
  // Public API
  // =========================================================
  public String transpile(String xml) {
    return transpile(reader.read(xml));
  }

  public String transpile(Path file) {
    return transpile(reader.read(file));
  }

  public String transpile(FlowDocument doc) {
    log.info("Transpiling flow '{}' ({})", doc.label(), doc.processType());
    Run run = new Run(doc);
    run.header();
    run.variables();
    run.formulas();
    run.engine.run(doc.start());
    return run.out.render();
  }

  public static Map<ElementKind, NodeRenderer> defaultRenderers() {
    Map<ElementKind, NodeRenderer> m = new EnumMap<>(ElementKind.class);
    m.put(ElementKind.ACTION_CALL, new ActionCallRenderer());
    m.put(ElementKind.RECORD_LOOKUP, new RecordLookupRenderer());
    m.put(ElementKind.RECORD_CREATE, new RecordCreateRenderer());
    m.put(ElementKind.RECORD_UPDATE, new RecordUpdateRenderer());
    m.put(ElementKind.ASSIGNMENT, new AssignmentRenderer());
    m.put(ElementKind.FORMULA, new FormulaRenderer());
    m.put(ElementKind.SCREEN, new ScreenRenderer());
    m.put(ElementKind.SUBFLOW, new SubflowRenderer());
    return m;
  }

  public static String mapProcessType(String processType) {
    if (processType == null) return "Unknown";
    return switch (processType) {
      case "AutoLaunchedFlow" -> "Autolaunched Flow";
      case "Flow" -> "Screen Flow";
      case "Workflow" -> "Workflow";
      case "RoutingFlow" -> "Service Routing Flow";
      case "InvocableProcess" -> "Process Builder";
      case "CustomEvent" -> "Platform Event Flow";
      case "ContactRequest" -> "Contact Request Flow";
      case "LoginFlow" -> "Login Flow";
      case "Survey" -> "Survey";
      case "SurveyResponse" -> "Survey Response Flow";
      default -> processType;
    };
  }

  // =========================================================
  // Per-transpile state
  // =========================================================
  private final class Run {
    final FlowDocument doc;
    final PseudocodeWriter out = new PseudocodeWriter(indentWidth);
    final VariableEnvironment env = new VariableEnvironment();
    final LoopContextStack loops = new LoopContextStack();
    final TraversalEngine engine;

    Run(FlowDocument doc) {
      this.doc = doc;
      this.engine = new TraversalEngine(doc.elements(), out, env, loops, renderers);
    }

    void header() {
      out.comment("Flow: " + doc.label());
      out.comment("Type: " + mapProcessType(doc.processType()));
      out.comment("Status: " + doc.status());
      doc.description().ifPresent(d -> out.comment("Description: " + d));
      out.blank();
    }

    void variables() {
      if (doc.variables().isEmpty()) return;
      out.comment("Variable Declarations");
      for (FlowVariable v : doc.variables()) {
        String type = TypeMapper.declaredType(v);
        env.declare(v.name(), type);
        out.line(v.isCollection() ? type + " " + v.name() + " = new " + type + "();" : type + " " + v.name() + ";");
      }
      out.blank();
    }

    void formulas() {
      Collection<FlowElement> formulas = doc.elements().ofKind(ElementKind.FORMULA);
      if (formulas.isEmpty()) return;
      out.comment("Formulas");
      for (FlowElement f : formulas) engine.emitStandalone(f);
    }
  }
}
