package symsat.symstate;

import java.util.List;

public final class SymBitVectorVar extends AbstractSymTerm implements SymBitVector {
  private final String name;
  private final int width;

  SymBitVectorVar(String name, int width) {
    super(SymKind.BV_VAR, List.of(name, width), List.of());
    this.name = name;
    this.width = width;
  }

  public String name() {
    return name;
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  void printAtom(StringBuilder builder) {
    builder.append(name);
  }
}
