package de.example.flow2apex.engine;

/** Rewrites a raw Flow reference into the name the generated code uses for it. */
@FunctionalInterface
public interface ValueResolver {
  String resolve(String rawReference);
}
