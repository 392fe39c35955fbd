package symsat.symstate;

import java.util.List;

/** Bits [lowBit, highBit] of the operand, both ends inclusive. */
public final class SymBitVectorExtract extends AbstractSymTerm implements SymBitVector {
  private final SymBitVector operand;
  private final int highBit, lowBit;

  SymBitVectorExtract(SymBitVector operand, int highBit, int lowBit) {
    super(SymKind.BV_EXTRACT, List.of(highBit, lowBit), List.of(operand));
    this.operand = operand;
    this.highBit = highBit;
    this.lowBit = lowBit;
  }

  public SymBitVector operand() {
    return operand;
  }

  public int highBit() {
    return highBit;
  }

  public int lowBit() {
    return lowBit;
  }

  @Override
  public int width() {
    return highBit - lowBit + 1;
  }
}
