package symsat.symstate;

import java.util.List;

/** AND, OR, XOR, IFF and IMPLIES. */
public final class SymBoolBinary extends AbstractSymTerm implements SymBool {
  private final SymBool a, b;

  SymBoolBinary(SymKind kind, SymBool a, SymBool b) {
    super(kind, List.of(), List.of(a, b));
    assert kind.isBoolConnective();
    this.a = a;
    this.b = b;
  }

  public SymBool a() {
    return a;
  }

  public SymBool b() {
    return b;
  }
}
