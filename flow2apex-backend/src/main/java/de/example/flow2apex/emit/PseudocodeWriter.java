package de.example.flow2apex.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output model of one transpile run.
 *
 * Lines go either to the main sequence or to the currently open named procedure and
 * carry the indentation depth they were written at. Indentation is applied once, in
 * {@link #render()}, where every procedure is appended after the main sequence in the
 * order it was first opened.
 *
 * Once the first procedure has been opened the writer is in method-only mode: writing
 * while no procedure is open fails with {@link IllegalStateException}.
 *
 * Not thread-safe; create one per run.
 */
public final class PseudocodeWriter {
  private static final Logger log = LoggerFactory.getLogger(PseudocodeWriter.class);

  record Line(String text, int depth) {}

  private static final class Procedure {
    final String name;
    final String returnType;
    final List<Line> lines = new ArrayList<>();

    Procedure(String name, String returnType) {
      this.name = name;
      this.returnType = returnType;
    }
  }

  // where writes currently land
  private static final class Frame {
    final String procedure;
    List<Line> sink;
    int depth;

    Frame(String procedure, List<Line> sink) {
      this.procedure = procedure;
      this.sink = sink;
    }
  }

  private final String indentUnit;
  private final List<Line> main = new ArrayList<>();
  private final Map<String, Procedure> procedures = new LinkedHashMap<>();
  private final Deque<Frame> callers = new ArrayDeque<>();
  private Frame current = new Frame(null, main);
  private boolean methodOnly;
  private String rendered;

  public PseudocodeWriter() {
    this(4);
  }

  public PseudocodeWriter(int indentWidth) {
    this.indentUnit = " ".repeat(Math.max(0, indentWidth));
  }

  // =========================================================
  // Writing
  // =========================================================
  public void line(String s) {
    if (methodOnly && current.procedure == null) {
      throw new IllegalStateException("Cannot write '" + s + "' to the main sequence after a procedure was opened");
    }
    current.sink.add(new Line(s, current.depth));
    rendered = null;
  }

  public void blank() {
    line("");
  }

  /** Blank separator line, skipped at the start of a buffer or right after a block opener. */
  public void paragraph() {
    List<Line> sink = current.sink;
    if (sink.isEmpty()) return;
    String last = sink.get(sink.size() - 1).text();
    if (last.isEmpty() || last.endsWith("{")) return;
    blank();
  }

  public void comment(String text) {
    line("// " + text);
  }

  /** Runs {@code body} one level deeper; the depth is restored even if it throws. */
  public void indent(Runnable body) {
    try (Scope ignored = openScope()) {
      body.run();
    }
  }

  public Scope openScope() {
    Frame f = current;
    int previous = f.depth;
    f.depth++;
    return () -> f.depth = previous;
  }

  public void closeScope() {
    if (current.depth == 0) throw new IllegalStateException("No indentation scope open");
    current.depth--;
  }

  public int depth() {
    return current.depth;
  }

  // =========================================================
  // Procedures
  // =========================================================
  /**
   * Redirects writes into procedure {@code name} until the returned scope is closed.
   * Reopening an existing procedure appends to it; its first return type wins.
   */
  public Scope openProcedure(String name, String returnType) {
    log.debug("Opening procedure {}", name);
    methodOnly = true;
    Procedure p = procedures.computeIfAbsent(name, n -> new Procedure(n, returnType));
    callers.push(current);
    Frame opened = new Frame(name, p.lines);
    current = opened;
    rendered = null;
    return () -> {
      if (current != opened) throw new IllegalStateException("Procedure " + name + " closed out of order");
      closeProcedure();
    };
  }

  public void closeProcedure() {
    if (callers.isEmpty()) throw new IllegalStateException("No procedure open");
    log.debug("Closing procedure {}", current.procedure);
    current = callers.pop();
  }

  public boolean hasProcedure(String name) {
    return procedures.containsKey(name);
  }

  public String currentProcedure() {
    return current.procedure;
  }

  public boolean isMethodOnly() {
    return methodOnly;
  }

  // =========================================================
  // Two-phase emission
  // =========================================================
  /**
   * Runs {@code body} with the current buffer swapped for a scratch list and returns
   * what it wrote. Procedures opened inside still land in their own buffers.
   */
  public CapturedLines capture(Runnable body) {
    Frame f = current;
    List<Line> real = f.sink;
    List<Line> scratch = new ArrayList<>();
    f.sink = scratch;
    try {
      body.run();
    } finally {
      f.sink = real;
    }
    return new CapturedLines(scratch);
  }

  /** Appends captured lines at the depth they were written at. */
  public void append(CapturedLines captured) {
    for (Line l : captured.lines) {
      if (methodOnly && current.procedure == null) {
        throw new IllegalStateException("Cannot append to the main sequence after a procedure was opened");
      }
      current.sink.add(l);
    }
    if (!captured.isEmpty()) rendered = null;
  }

  // =========================================================
  // Rendering
  // =========================================================
  public String render() {
    if (rendered != null) return rendered;
    StringBuilder sb = new StringBuilder();
    for (Line l : main) appendLine(sb, "", l);
    for (Procedure p : procedures.values()) {
      sb.append(ProcedureSignatureBuilder.buildHeader(p.name, p.returnType)).append('\n');
      for (Line l : p.lines) appendLine(sb, indentUnit, l);
      sb.append("}\n\n");
    }
    rendered = sb.toString();
    return rendered;
  }

  private void appendLine(StringBuilder sb, String base, Line l) {
    if (!l.text().isEmpty()) {
      sb.append(base).append(indentUnit.repeat(Math.max(0, l.depth()))).append(l.text());
    }
    sb.append('\n');
  }

  @Override
  public String toString() {
    return render();
  }
}
