package symsat.solver;

import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import symsat.symstate.SymBool;
import symsat.symstate.SymFunction;
import symsat.symstate.SymTerm;

import java.util.*;
import java.util.function.Supplier;

/**
 * State of one query: the atomic constraints of the current round, the side
 * constraints emitted while lowering them (next round), the lowered assertions,
 * and the lowering memo. Created by each {@link Z3Solver#isSat} call and
 * dropped at its end.
 */
class QueryBatch {
  private List<SymBool> pending;
  private final List<SymBool> derived = new ArrayList<>();
  private final List<BoolExpr> lowered = new ArrayList<>();
  private final Map<SymTerm, Expr<?>> memo = new IdentityHashMap<>();
  private final Map<SymFunction, FuncDecl<BitVecSort>> functions = new HashMap<>();
  private int round = 0;

  QueryBatch(List<SymBool> atomicConstraints) {
    this.pending = new ArrayList<>(atomicConstraints);
  }

  boolean hasPending() {
    return !pending.isEmpty();
  }

  List<SymBool> pending() {
    return Collections.unmodifiableList(pending);
  }

  /** Makes the side constraints of this round the pending constraints of the next. */
  void nextRound() {
    pending = new ArrayList<>(derived);
    derived.clear();
    ++round;
  }

  int round() {
    return round;
  }

  void addDerived(SymBool constraint) {
    derived.add(constraint);
  }

  List<SymBool> derived() {
    return Collections.unmodifiableList(derived);
  }

  void addLowered(BoolExpr assertion) {
    lowered.add(assertion);
  }

  List<BoolExpr> lowered() {
    return Collections.unmodifiableList(lowered);
  }

  boolean isLowered(SymTerm term) {
    return memo.containsKey(term);
  }

  Expr<?> loweredOf(SymTerm term) {
    return memo.get(term);
  }

  void putLowered(SymTerm term, Expr<?> expr) {
    memo.put(term, expr);
  }

  int numLoweredTerms() {
    return memo.size();
  }

  FuncDecl<BitVecSort> declareFunction(SymFunction function, Supplier<FuncDecl<BitVecSort>> declare) {
    return functions.computeIfAbsent(function, ignored -> declare.get());
  }

  int numFunctions() {
    return functions.size();
  }
}
