package symsat.symstate;

import java.util.List;

public final class SymBitVectorBinary extends AbstractSymTerm implements SymBitVector {
  private final SymBitVector a, b;
  private final int width;

  SymBitVectorBinary(SymKind kind, SymBitVector a, SymBitVector b) {
    super(kind, List.of(), List.of(a, b));
    assert kind.isBinaryBitVectorOp();
    this.a = a;
    this.b = b;
    this.width = kind == SymKind.BV_CONCAT ? a.width() + b.width() : a.width();
  }

  public SymBitVector a() {
    return a;
  }

  public SymBitVector b() {
    return b;
  }

  @Override
  public int width() {
    return width;
  }
}
