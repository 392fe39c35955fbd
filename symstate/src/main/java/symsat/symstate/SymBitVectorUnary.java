package symsat.symstate;

import java.util.List;

/** Bitwise NOT and two's complement negation. */
public final class SymBitVectorUnary extends AbstractSymTerm implements SymBitVector {
  private final SymBitVector operand;

  SymBitVectorUnary(SymKind kind, SymBitVector operand) {
    super(kind, List.of(), List.of(operand));
    assert kind == SymKind.BV_NOT || kind == SymKind.BV_UMINUS;
    this.operand = operand;
  }

  public SymBitVector operand() {
    return operand;
  }

  @Override
  public int width() {
    return operand.width();
  }
}
