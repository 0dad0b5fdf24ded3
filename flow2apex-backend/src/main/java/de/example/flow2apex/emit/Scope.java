package de.example.flow2apex.emit;

/** Guard returned by {@link PseudocodeWriter}; closing it restores the state captured at open time. */
@FunctionalInterface
public interface Scope extends AutoCloseable {
  @Override
  void close();
}
