package symsat.symstate;

import java.util.List;

/** Equality and the signed/unsigned orderings over two bit vectors. */
public final class SymBoolCompare extends AbstractSymTerm implements SymBool {
  private final SymBitVector a, b;

  SymBoolCompare(SymKind kind, SymBitVector a, SymBitVector b) {
    super(kind, List.of(), List.of(a, b));
    assert kind.isComparison();
    this.a = a;
    this.b = b;
  }

  public SymBitVector a() {
    return a;
  }

  public SymBitVector b() {
    return b;
  }
}
