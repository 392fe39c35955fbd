package symsat.symstate;

import java.util.List;

public final class SymBoolArrayEq extends AbstractSymTerm implements SymBool {
  private final SymArray a, b;

  SymBoolArrayEq(SymArray a, SymArray b) {
    super(SymKind.ARRAY_EQ, List.of(), List.of(a, b));
    this.a = a;
    this.b = b;
  }

  public SymArray a() {
    return a;
  }

  public SymArray b() {
    return b;
  }
}
