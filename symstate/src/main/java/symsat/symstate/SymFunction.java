package symsat.symstate;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An uninterpreted function symbol over bit vectors.
 *
 * <p>A symbol may carry axioms: facts about the function (typically quantified)
 * that every query mentioning the symbol must include. See {@link SymAxiomCollector}.
 * Axioms do not take part in equality; two symbols are the same symbol iff their
 * names and signatures agree.
 */
public final class SymFunction {
  private final String name;
  private final List<Integer> argWidths;
  private final int returnWidth;
  private final List<SymBool> axioms;

  private SymFunction(String name, List<Integer> argWidths, int returnWidth, List<SymBool> axioms) {
    this.name = name;
    this.argWidths = ImmutableList.copyOf(argWidths);
    this.returnWidth = returnWidth;
    this.axioms = ImmutableList.copyOf(axioms);
  }

  public static SymFunction mk(String name, int returnWidth, Integer... argWidths) {
    return new SymFunction(name, List.of(argWidths), returnWidth, List.of());
  }

  public static SymFunction mk(String name, int returnWidth, List<Integer> argWidths) {
    return new SymFunction(name, argWidths, returnWidth, List.of());
  }

  /** A copy of this symbol with one more axiom attached. */
  public SymFunction withAxiom(SymBool axiom) {
    final List<SymBool> newAxioms = new ArrayList<>(axioms);
    newAxioms.add(axiom);
    return new SymFunction(name, argWidths, returnWidth, newAxioms);
  }

  public String name() {
    return name;
  }

  public List<Integer> argWidths() {
    return argWidths;
  }

  public int arity() {
    return argWidths.size();
  }

  public int returnWidth() {
    return returnWidth;
  }

  public List<SymBool> axioms() {
    return axioms;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SymFunction)) return false;
    final SymFunction that = (SymFunction) obj;
    return returnWidth == that.returnWidth
        && name.equals(that.name)
        && argWidths.equals(that.argWidths);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, argWidths, returnWidth);
  }

  @Override
  public String toString() {
    return name;
  }
}
