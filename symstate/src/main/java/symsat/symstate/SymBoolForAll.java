package symsat.symstate;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Universal quantification of a body over bit-vector variables. The bound
 * variables are attributes, not operands: traversals only descend into the body.
 */
public final class SymBoolForAll extends AbstractSymTerm implements SymBool {
  private final List<SymBitVectorVar> boundVars;
  private final SymBool body;

  SymBoolForAll(List<SymBitVectorVar> boundVars, SymBool body) {
    super(SymKind.FOR_ALL, List.of(ImmutableList.copyOf(boundVars)), List.of(body));
    this.boundVars = ImmutableList.copyOf(boundVars);
    this.body = body;
  }

  public List<SymBitVectorVar> boundVars() {
    return boundVars;
  }

  public SymBool body() {
    return body;
  }
}
