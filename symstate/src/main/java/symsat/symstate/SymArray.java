package symsat.symstate;

/** An array-sorted term mapping keyWidth-bit keys to valueWidth-bit values. */
public interface SymArray extends SymTerm {

  int keyWidth();

  int valueWidth();

  static SymArrayVar mkVar(String name, int keyWidth, int valueWidth) {
    return new SymArrayVar(name, keyWidth, valueWidth);
  }

  static SymArray mkStore(SymArray array, SymBitVector key, SymBitVector value) {
    return new SymArrayStore(array, key, value);
  }
}
