package de.example.flow2apex.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * kind -> (name -> element). Names are unique within one kind only, so {@link #find(String)}
 * searches every bucket in declaration order of {@link ElementKind}.
 */
public final class ElementMap {
  private final Map<ElementKind, Map<String, FlowElement>> buckets = new EnumMap<>(ElementKind.class);

  public void add(FlowElement element) {
    buckets.computeIfAbsent(element.kind(), k -> new LinkedHashMap<>()).put(element.name(), element);
  }

  public Optional<FlowElement> find(String name) {
    if (name == null) return Optional.empty();
    for (ElementKind k : ElementKind.values()) {
      Map<String, FlowElement> bucket = buckets.get(k);
      if (bucket != null && bucket.containsKey(name)) return Optional.of(bucket.get(name));
    }
    return Optional.empty();
  }

  public Optional<FlowElement> find(ElementKind kind, String name) {
    Map<String, FlowElement> bucket = buckets.get(kind);
    return bucket == null ? Optional.empty() : Optional.ofNullable(bucket.get(name));
  }

  public Collection<FlowElement> ofKind(ElementKind kind) {
    Map<String, FlowElement> bucket = buckets.get(kind);
    return bucket == null ? List.of() : bucket.values();
  }

  public List<FlowElement> all() {
    List<FlowElement> out = new ArrayList<>();
    for (Map<String, FlowElement> bucket : buckets.values()) out.addAll(bucket.values());
    return out;
  }
}
