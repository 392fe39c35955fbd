package symsat.symstate;

import java.util.List;

public final class SymBitVectorArrayLookup extends AbstractSymTerm implements SymBitVector {
  private final SymArray array;
  private final SymBitVector key;

  SymBitVectorArrayLookup(SymArray array, SymBitVector key) {
    super(SymKind.BV_ARRAY_LOOKUP, List.of(), List.of(array, key));
    this.array = array;
    this.key = key;
  }

  public SymArray array() {
    return array;
  }

  public SymBitVector key() {
    return key;
  }

  @Override
  public int width() {
    return array.valueWidth();
  }
}
