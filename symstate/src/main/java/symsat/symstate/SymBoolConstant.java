package symsat.symstate;

import java.util.List;

public final class SymBoolConstant extends AbstractSymTerm implements SymBool {
  static final SymBoolConstant TRUE_CONST = new SymBoolConstant(SymKind.TRUE);
  static final SymBoolConstant FALSE_CONST = new SymBoolConstant(SymKind.FALSE);

  private SymBoolConstant(SymKind kind) {
    super(kind, List.of(), List.of());
  }

  public boolean value() {
    return kind() == SymKind.TRUE;
  }

  @Override
  void printAtom(StringBuilder builder) {
    builder.append(kind().text());
  }
}
