package symsat.symstate;

import java.util.List;

/**
 * A node of the symbolic term algebra. Terms are immutable and may be shared
 * between several parents, so a constraint set forms a DAG rather than a tree.
 */
public interface SymTerm {

  SymKind kind();

  /** The direct term operands, in operand order. */
  List<SymTerm> subTerms();

  default SymKind.Sort sort() {
    return kind().sort();
  }
}
