package symsat.symstate;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Application of an uninterpreted function. */
public final class SymBitVectorFunction extends AbstractSymTerm implements SymBitVector {
  private final SymFunction function;
  private final List<SymBitVector> args;

  SymBitVectorFunction(SymFunction function, List<? extends SymBitVector> args) {
    super(SymKind.BV_FUNCTION, List.of(function), args);
    this.function = function;
    this.args = ImmutableList.copyOf(args);
  }

  public SymFunction function() {
    return function;
  }

  public List<SymBitVector> args() {
    return args;
  }

  @Override
  public int width() {
    return function.returnWidth();
  }
}
