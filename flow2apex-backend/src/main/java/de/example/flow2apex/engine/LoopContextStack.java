package de.example.flow2apex.engine;

import de.example.flow2apex.emit.Scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Loops whose body is being emitted right now, innermost on top. */
public final class LoopContextStack {
  private final Deque<LoopContext> stack = new ArrayDeque<>();

  /** Pushes {@code ctx}; closing the returned scope pops it again. */
  public Scope enter(LoopContext ctx) {
    stack.push(ctx);
    return () -> {
      if (stack.peek() != ctx) throw new IllegalStateException("Loop context " + ctx.loopId() + " released out of order");
      stack.pop();
    };
  }

  public Optional<LoopContext> current() {
    return Optional.ofNullable(stack.peek());
  }

  public boolean isActive() {
    return !stack.isEmpty();
  }

  public boolean isInnermostLoop(String id) {
    LoopContext top = stack.peek();
    return top != null && top.loopId().equals(id);
  }

  /** Innermost first. */
  public List<LoopContext> innermostFirst() {
    return new ArrayList<>(stack);
  }

  public int depth() {
    return stack.size();
  }
}
