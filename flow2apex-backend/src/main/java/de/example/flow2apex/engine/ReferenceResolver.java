package de.example.flow2apex.engine;

import java.util.Optional;

/**
 * Record-, loop- and formula-aware reference rewriting, bound to the live loop stack
 * and environment of one run.
 */
public final class ReferenceResolver {
  private static final String RECORD = "$Record.";
  private static final String PRIOR = "$Record__Prior.";
  private static final String LOOP = "$Loop.";

  private final LoopContextStack loops;
  private final VariableEnvironment env;

  public ReferenceResolver(LoopContextStack loops, VariableEnvironment env) {
    this.loops = loops;
    this.env = env;
  }

  /** Resolver whose failures are attributed to {@code elementName}. */
  public ValueResolver forElement(String elementName) {
    return ref -> resolve(ref, elementName);
  }

  public String resolve(String ref, String elementName) {
    if (ref == null || ref.isBlank()) return "unknown";
    String r = ref.trim();

    Optional<String> fn = env.functionOf(r);
    if (fn.isPresent()) return fn.get() + "()";

    if (r.equals("$Record")) return "record";
    if (r.equals("$Record__Prior")) return "oldRecord";
    if (r.startsWith(PRIOR)) return "oldRecord." + r.substring(PRIOR.length());
    if (r.startsWith(RECORD)) return "record." + r.substring(RECORD.length());
    if (r.startsWith(LOOP)) {
      LoopContext ctx = loops.current()
          .orElseThrow(() -> new ElementProcessingException(elementName, "No loop variable in scope for " + r));
      return ctx.loopVariable() + "." + r.substring(LOOP.length());
    }
    if (r.startsWith("$")) return r.substring(1);

    for (LoopContext ctx : loops.innermostFirst()) {
      Optional<String> viaCollection = rebase(r, ctx.collection(), ctx.loopVariable());
      if (viaCollection.isPresent()) return viaCollection.get();
      Optional<String> loopName = env.loopNameOf(ctx.loopVariable());
      if (loopName.isPresent()) {
        Optional<String> viaLoop = rebase(r, loopName.get(), ctx.loopVariable());
        if (viaLoop.isPresent()) return viaLoop.get();
      }
    }
    return r;
  }

  // "Accounts" -> "a", "Accounts.Name" -> "a.Name"
  private static Optional<String> rebase(String ref, String head, String var) {
    if (head == null || head.isEmpty()) return Optional.empty();
    if (ref.equals(head)) return Optional.of(var);
    if (ref.startsWith(head + ".")) return Optional.of(var + ref.substring(head.length()));
    return Optional.empty();
  }
}
