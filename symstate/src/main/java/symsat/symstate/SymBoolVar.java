package symsat.symstate;

import java.util.List;

public final class SymBoolVar extends AbstractSymTerm implements SymBool {
  private final String name;

  SymBoolVar(String name) {
    super(SymKind.BOOL_VAR, List.of(name), List.of());
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  void printAtom(StringBuilder builder) {
    builder.append(name);
  }
}
