package symsat.symstate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.*;

/**
 * Structural equality over (class, kind, attributes, operands). The hash is
 * computed once at construction from the cached hashes of the operands.
 *
 * <p>Comparison and printing walk the operands with explicit stacks. Each pair
 * of nodes is compared at most once, so shared sub-terms cost linear time.
 */
abstract class AbstractSymTerm implements SymTerm {
  private final SymKind kind;
  // non-term fields that take part in equality, e.g. names, widths and literals
  private final ImmutableList<Object> attributes;
  private final ImmutableList<SymTerm> subTerms;
  private final int hash;

  AbstractSymTerm(SymKind kind, List<?> attributes, List<? extends SymTerm> subTerms) {
    this.kind = kind;
    this.attributes = ImmutableList.<Object>copyOf(attributes);
    this.subTerms = ImmutableList.copyOf(subTerms);
    this.hash = 31 * Objects.hash(getClass().getName(), kind, this.attributes) + this.subTerms.hashCode();
  }

  @Override
  public SymKind kind() {
    return kind;
  }

  @Override
  public List<SymTerm> subTerms() {
    return subTerms;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || obj.getClass() != getClass()) return false;

    final Map<SymTerm, Set<SymTerm>> compared = new IdentityHashMap<>();
    final Deque<AbstractSymTerm> stack = new ArrayDeque<>();
    stack.push(this);
    stack.push((AbstractSymTerm) obj);
    while (!stack.isEmpty()) {
      final AbstractSymTerm b = stack.pop();
      final AbstractSymTerm a = stack.pop();
      if (a == b || !compared.computeIfAbsent(a, k -> Sets.newIdentityHashSet()).add(b)) continue;
      if (!sameNode(a, b)) return false;

      for (int i = 0; i < a.subTerms.size(); ++i) {
        stack.push((AbstractSymTerm) a.subTerms.get(i));
        stack.push((AbstractSymTerm) b.subTerms.get(i));
      }
    }
    return true;
  }

  /** Compares everything but the operands. */
  private static boolean sameNode(AbstractSymTerm a, AbstractSymTerm b) {
    return a.hash == b.hash
        && a.getClass() == b.getClass()
        && a.kind == b.kind
        && a.subTerms.size() == b.subTerms.size()
        && a.attributes.equals(b.attributes);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return new SymPrinter(Integer.MAX_VALUE).print(this);
  }

  /** Prints a node that has no operands. */
  void printAtom(StringBuilder builder) {
    printHead(builder);
    builder.append(')');
  }

  /** Prints the opening parenthesis, the operator and the attributes. */
  void printHead(StringBuilder builder) {
    builder.append('(').append(kind.text());
    for (Object attr : attributes) builder.append(' ').append(attr);
  }
}
