package symsat.symstate;

import java.util.*;

public abstract class SymSupport {
  /** Length at which terms quoted in error messages are cut. */
  public static final int DIAGNOSTIC_CHARS = 2048;

  private SymSupport() {}

  public static boolean isConjunction(SymBool constraint) {
    return constraint.kind() == SymKind.AND;
  }

  /**
   * Splits top-level conjunctions until no element is an AND. The result keeps
   * the operands in left-to-right order, constraint by constraint.
   */
  public static List<SymBool> flattenConjunctions(List<? extends SymBool> constraints) {
    final List<SymBool> split = new ArrayList<>(constraints.size());
    final Deque<SymBool> stack = new ArrayDeque<>();
    for (SymBool constraint : constraints) {
      stack.push(constraint);
      while (!stack.isEmpty()) {
        final SymBool c = stack.pop();
        if (isConjunction(c)) {
          final SymBoolBinary and = (SymBoolBinary) c;
          stack.push(and.b());
          stack.push(and.a());
        } else {
          split.add(c);
        }
      }
    }
    return split;
  }

  /** Number of distinct nodes (by identity) reachable from the term. */
  public static int countNodes(SymTerm term) {
    final Set<SymTerm> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    final Deque<SymTerm> worklist = new ArrayDeque<>();
    worklist.push(term);
    while (!worklist.isEmpty()) {
      final SymTerm t = worklist.pop();
      if (visited.add(t)) t.subTerms().forEach(worklist::push);
    }
    return visited.size();
  }

  /** The printed term, cut after {@link #DIAGNOSTIC_CHARS} characters. */
  public static String abbreviate(SymTerm term) {
    return abbreviate(term, DIAGNOSTIC_CHARS);
  }

  public static String abbreviate(SymTerm term, int maxChars) {
    return new SymPrinter(maxChars).print(term);
  }
}
