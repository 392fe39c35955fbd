package symsat.symstate;

import java.util.List;

public final class SymBitVectorIte extends AbstractSymTerm implements SymBitVector {
  private final SymBool cond;
  private final SymBitVector a, b;

  SymBitVectorIte(SymBool cond, SymBitVector a, SymBitVector b) {
    super(SymKind.BV_ITE, List.of(), List.of(cond, a, b));
    this.cond = cond;
    this.a = a;
    this.b = b;
  }

  public SymBool cond() {
    return cond;
  }

  public SymBitVector a() {
    return a;
  }

  public SymBitVector b() {
    return b;
  }

  @Override
  public int width() {
    return a.width();
  }
}
