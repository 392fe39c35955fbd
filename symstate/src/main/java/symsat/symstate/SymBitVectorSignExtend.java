package symsat.symstate;

import java.util.List;

public final class SymBitVectorSignExtend extends AbstractSymTerm implements SymBitVector {
  private final SymBitVector operand;
  private final int size;

  SymBitVectorSignExtend(SymBitVector operand, int size) {
    super(SymKind.BV_SIGN_EXTEND, List.of(size), List.of(operand));
    this.operand = operand;
    this.size = size;
  }

  public SymBitVector operand() {
    return operand;
  }

  @Override
  public int width() {
    return size;
  }
}
