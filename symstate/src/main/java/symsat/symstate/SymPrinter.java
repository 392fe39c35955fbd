package symsat.symstate;

import com.google.common.collect.Sets;

import java.util.*;

/**
 * Prints a term in prefix form with an explicit stack.
 *
 * <p>A node with operands that is reachable along more than one path is printed
 * in full once, labelled {@code #n=}, and as {@code #n} at every later
 * occurrence. A term without shared nodes prints as the plain nested form.
 * Output longer than the limit is cut and ends with {@value #ELLIPSIS}.
 */
final class SymPrinter {
  static final String ELLIPSIS = "...";

  private final int maxChars;
  // shared nodes; 0 until the node is printed for the first time
  private final Map<SymTerm, Integer> labels = new IdentityHashMap<>();
  private final StringBuilder builder = new StringBuilder();
  private int nextLabel = 1;

  SymPrinter(int maxChars) {
    this.maxChars = maxChars;
  }

  String print(SymTerm root) {
    markShared(root);

    final Deque<Object> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty() && builder.length() <= maxChars) {
      final Object top = stack.pop();
      if (top instanceof String) builder.append((String) top);
      else printNode((AbstractSymTerm) top, stack);
    }

    if (builder.length() > maxChars) {
      builder.setLength(maxChars);
      builder.append(ELLIPSIS);
    }
    return builder.toString();
  }

  private void markShared(SymTerm root) {
    final Set<SymTerm> visited = Sets.newIdentityHashSet();
    final Deque<SymTerm> worklist = new ArrayDeque<>();
    worklist.push(root);
    while (!worklist.isEmpty()) {
      final SymTerm term = worklist.pop();
      if (visited.add(term)) term.subTerms().forEach(worklist::push);
      else if (!term.subTerms().isEmpty()) labels.put(term, 0);
    }
  }

  private void printNode(AbstractSymTerm term, Deque<Object> stack) {
    final List<SymTerm> subTerms = term.subTerms();
    if (subTerms.isEmpty()) {
      term.printAtom(builder);
      return;
    }

    final Integer label = labels.get(term);
    if (label != null && label > 0) {
      builder.append('#').append(label);
      return;
    }
    if (label != null) {
      labels.put(term, nextLabel);
      builder.append('#').append(nextLabel++).append('=');
    }

    term.printHead(builder);
    stack.push(")");
    for (int i = subTerms.size() - 1; i >= 0; --i) {
      stack.push(subTerms.get(i));
      stack.push(" ");
    }
  }
}
