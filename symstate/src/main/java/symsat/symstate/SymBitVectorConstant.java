package symsat.symstate;

import java.math.BigInteger;
import java.util.List;

public final class SymBitVectorConstant extends AbstractSymTerm implements SymBitVector {
  private final int width;
  private final BigInteger value;

  SymBitVectorConstant(int width, BigInteger value) {
    super(SymKind.BV_CONSTANT, List.of(width, normalize(width, value)), List.of());
    this.width = width;
    this.value = normalize(width, value);
  }

  private static BigInteger normalize(int width, BigInteger value) {
    // widths are validated by the typechecker, not here
    if (width <= 0) return value;
    return value.mod(BigInteger.ONE.shiftLeft(width));
  }

  @Override
  public int width() {
    return width;
  }

  /** The unsigned value, in [0, 2^width). */
  public BigInteger value() {
    return value;
  }

  @Override
  void printAtom(StringBuilder builder) {
    builder.append("(_ bv").append(value).append(' ').append(width).append(')');
  }
}
