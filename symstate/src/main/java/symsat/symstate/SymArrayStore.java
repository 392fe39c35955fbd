package symsat.symstate;

import java.util.List;

/** The array that agrees with {@code array} everywhere except at {@code key}. */
public final class SymArrayStore extends AbstractSymTerm implements SymArray {
  private final SymArray array;
  private final SymBitVector key, value;

  SymArrayStore(SymArray array, SymBitVector key, SymBitVector value) {
    super(SymKind.ARRAY_STORE, List.of(), List.of(array, key, value));
    this.array = array;
    this.key = key;
    this.value = value;
  }

  public SymArray array() {
    return array;
  }

  public SymBitVector key() {
    return key;
  }

  public SymBitVector value() {
    return value;
  }

  @Override
  public int keyWidth() {
    return array.keyWidth();
  }

  @Override
  public int valueWidth() {
    return array.valueWidth();
  }
}
