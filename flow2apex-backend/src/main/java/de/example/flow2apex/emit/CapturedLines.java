package de.example.flow2apex.emit;

import java.util.List;

/** Lines written during {@link PseudocodeWriter#capture(Runnable)}, not yet part of any buffer. */
public final class CapturedLines {
  final List<PseudocodeWriter.Line> lines;

  CapturedLines(List<PseudocodeWriter.Line> lines) {
    this.lines = List.copyOf(lines);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public int size() {
    return lines.size();
  }
}
