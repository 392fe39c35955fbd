package symsat.symstate;

import com.google.common.collect.Sets;

import java.util.*;

/**
 * Collects the background axioms implied by a constraint set: the axioms
 * attached to every uninterpreted function symbol reachable from any
 * constraint, transitively through the axioms themselves.
 */
public class SymAxiomCollector {
  private final Set<SymTerm> visited = Sets.newIdentityHashSet();
  private final Set<SymBool> axioms = new LinkedHashSet<>();

  public void collect(SymBool constraint) {
    final Deque<SymTerm> worklist = new ArrayDeque<>();
    worklist.push(constraint);
    while (!worklist.isEmpty()) {
      final SymTerm term = worklist.pop();
      if (!visited.add(term)) continue;

      if (term.kind() == SymKind.BV_FUNCTION) {
        for (SymBool axiom : ((SymBitVectorFunction) term).function().axioms())
          if (axioms.add(axiom)) worklist.push(axiom);
      }
      for (SymTerm sub : term.subTerms()) worklist.push(sub);
    }
  }

  public void collect(Collection<? extends SymBool> constraints) {
    for (SymBool constraint : constraints) collect(constraint);
  }

  /** Axioms in first-encounter order, without duplicates. */
  public List<SymBool> axioms() {
    return new ArrayList<>(axioms);
  }

  /**
   * The constraints followed by every implied axiom not already among them.
   * Closing an already closed list returns an equal list.
   */
  public static List<SymBool> close(List<? extends SymBool> constraints) {
    final SymAxiomCollector collector = new SymAxiomCollector();
    collector.collect(constraints);

    final List<SymBool> result = new ArrayList<>(constraints);
    final Set<SymBool> present = new HashSet<>(constraints);
    for (SymBool axiom : collector.axioms)
      if (present.add(axiom)) result.add(axiom);
    return result;
  }
}
