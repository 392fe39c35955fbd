package symsat.symstate;

import java.util.List;

public final class SymArrayVar extends AbstractSymTerm implements SymArray {
  private final String name;
  private final int keyWidth, valueWidth;

  SymArrayVar(String name, int keyWidth, int valueWidth) {
    super(SymKind.ARRAY_VAR, List.of(name, keyWidth, valueWidth), List.of());
    this.name = name;
    this.keyWidth = keyWidth;
    this.valueWidth = valueWidth;
  }

  public String name() {
    return name;
  }

  @Override
  public int keyWidth() {
    return keyWidth;
  }

  @Override
  public int valueWidth() {
    return valueWidth;
  }

  @Override
  void printAtom(StringBuilder builder) {
    builder.append(name);
  }
}
