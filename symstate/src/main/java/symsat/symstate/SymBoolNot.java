package symsat.symstate;

import java.util.List;

public final class SymBoolNot extends AbstractSymTerm implements SymBool {
  private final SymBool operand;

  SymBoolNot(SymBool operand) {
    super(SymKind.NOT, List.of(), List.of(operand));
    this.operand = operand;
  }

  public SymBool operand() {
    return operand;
  }
}
