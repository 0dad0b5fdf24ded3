package de.example.flow2apex.engine;

public record LoopContext(String loopId, String loopVariable, String collection) {
}
