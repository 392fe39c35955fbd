package symsat.solver;

import com.microsoft.z3.*;
import symsat.symstate.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Translates well-typed constraints into Z3 terms.
 *
 * <p>Terms are lowered bottom-up with an explicit stack, so the depth of a
 * constraint is not bounded by the call stack. Every node is lowered once per
 * query; the result is kept in the {@link QueryBatch} memo by node identity.
 *
 * <p>Signed division emits the side constraint {@code divisor != 0} into the
 * batch. It is typechecked and lowered in the next round like any other
 * constraint.
 */
class Z3Lowering {
  static final int MAX_FUNCTION_ARITY = 3;
  static final int MAX_BOUND_VARS = 3;

  private final Context ctx;
  private final QueryBatch batch;

  Z3Lowering(Context ctx, QueryBatch batch) {
    this.ctx = ctx;
    this.batch = batch;
  }

  BoolExpr lower(SymBool constraint) {
    return (BoolExpr) lowerTerm(constraint);
  }

  Expr<?> lowerTerm(SymTerm root) {
    final Deque<SymTerm> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      final SymTerm term = stack.peek();
      if (batch.isLowered(term)) {
        stack.pop();
        continue;
      }

      boolean ready = true;
      for (SymTerm sub : term.subTerms()) {
        if (!batch.isLowered(sub)) {
          stack.push(sub);
          ready = false;
        }
      }
      if (!ready) continue;

      stack.pop();
      batch.putLowered(term, translate(term));
    }
    return batch.loweredOf(root);
  }

  /** Lowers one node whose operands are all lowered already. */
  private Expr<?> translate(SymTerm t) {
    return switch (t.kind()) {
      case TRUE -> ctx.mkTrue();
      case FALSE -> ctx.mkFalse();
      case BOOL_VAR -> ctx.mkBoolConst(((SymBoolVar) t).name());
      case NOT -> ctx.mkNot(bool(t, 0));
      case AND -> ctx.mkAnd(bool(t, 0), bool(t, 1));
      case OR -> ctx.mkOr(bool(t, 0), bool(t, 1));
      case XOR -> ctx.mkXor(bool(t, 0), bool(t, 1));
      case IFF -> ctx.mkIff(bool(t, 0), bool(t, 1));
      case IMPLIES -> ctx.mkImplies(bool(t, 0), bool(t, 1));
      case EQ -> ctx.mkEq(bv(t, 0), bv(t, 1));
      case LT -> ctx.mkBVULT(bv(t, 0), bv(t, 1));
      case LE -> ctx.mkBVULE(bv(t, 0), bv(t, 1));
      case GT -> ctx.mkBVUGT(bv(t, 0), bv(t, 1));
      case GE -> ctx.mkBVUGE(bv(t, 0), bv(t, 1));
      case SIGN_LT -> ctx.mkBVSLT(bv(t, 0), bv(t, 1));
      case SIGN_LE -> ctx.mkBVSLE(bv(t, 0), bv(t, 1));
      case SIGN_GT -> ctx.mkBVSGT(bv(t, 0), bv(t, 1));
      case SIGN_GE -> ctx.mkBVSGE(bv(t, 0), bv(t, 1));
      case ARRAY_EQ -> ctx.mkEq(array(t, 0), array(t, 1));
      case FOR_ALL -> lowerForAll((SymBoolForAll) t);

      case BV_CONSTANT -> {
        final SymBitVectorConstant c = (SymBitVectorConstant) t;
        yield ctx.mkBV(c.value().toString(), c.width());
      }
      case BV_VAR -> {
        final SymBitVectorVar v = (SymBitVectorVar) t;
        yield ctx.mkBVConst(v.name(), v.width());
      }
      case BV_NOT -> ctx.mkBVNot(bv(t, 0));
      case BV_UMINUS -> ctx.mkBVNeg(bv(t, 0));
      case BV_AND -> ctx.mkBVAND(bv(t, 0), bv(t, 1));
      case BV_OR -> ctx.mkBVOR(bv(t, 0), bv(t, 1));
      case BV_XOR -> ctx.mkBVXOR(bv(t, 0), bv(t, 1));
      case BV_PLUS -> ctx.mkBVAdd(bv(t, 0), bv(t, 1));
      case BV_MINUS -> ctx.mkBVSub(bv(t, 0), bv(t, 1));
      case BV_MULT -> ctx.mkBVMul(bv(t, 0), bv(t, 1));
      case BV_DIV -> ctx.mkBVUDiv(bv(t, 0), bv(t, 1));
      case BV_MOD -> ctx.mkBVURem(bv(t, 0), bv(t, 1));
      case BV_SIGN_DIV -> lowerSignDiv((SymBitVectorBinary) t);
      case BV_SIGN_MOD -> ctx.mkBVSRem(bv(t, 0), bv(t, 1));
      case BV_SHIFT_LEFT -> ctx.mkBVSHL(bv(t, 0), bv(t, 1));
      case BV_SHIFT_RIGHT -> ctx.mkBVLSHR(bv(t, 0), bv(t, 1));
      case BV_SIGN_SHIFT_RIGHT -> ctx.mkBVASHR(bv(t, 0), bv(t, 1));
      case BV_ROTATE_LEFT -> ctx.mkBVRotateLeft(bv(t, 0), bv(t, 1));
      case BV_ROTATE_RIGHT -> ctx.mkBVRotateRight(bv(t, 0), bv(t, 1));
      case BV_CONCAT -> ctx.mkConcat(bv(t, 0), bv(t, 1));
      case BV_EXTRACT -> {
        final SymBitVectorExtract ext = (SymBitVectorExtract) t;
        yield ctx.mkExtract(ext.highBit(), ext.lowBit(), bv(t, 0));
      }
      case BV_SIGN_EXTEND -> {
        final SymBitVectorSignExtend ext = (SymBitVectorSignExtend) t;
        yield ctx.mkSignExt(ext.width() - ext.operand().width(), bv(t, 0));
      }
      case BV_ITE -> (BitVecExpr) ctx.mkITE(bool(t, 0), bv(t, 1), bv(t, 2));
      case BV_FUNCTION -> lowerApply((SymBitVectorFunction) t);
      case BV_ARRAY_LOOKUP -> (BitVecExpr) ctx.mkSelect(array(t, 0), bv(t, 1));

      case ARRAY_VAR -> {
        final SymArrayVar a = (SymArrayVar) t;
        yield ctx.mkArrayConst(
            a.name(), ctx.mkBitVecSort(a.keyWidth()), ctx.mkBitVecSort(a.valueWidth()));
      }
      case ARRAY_STORE -> ctx.mkStore(array(t, 0), bv(t, 1), bv(t, 2));
    };
  }

  private BitVecExpr lowerSignDiv(SymBitVectorBinary div) {
    final SymBitVector divisor = div.b();
    batch.addDerived(SymBool.mkNe(divisor, SymBitVector.mkConstant(divisor.width(), 0)));
    return ctx.mkBVSDiv(bv(div, 0), bv(div, 1));
  }

  private BitVecExpr lowerApply(SymBitVectorFunction app) {
    final SymFunction f = app.function();
    if (f.arity() == 0)
      throw new SolverException(
          ErrorKind.LOWERING_FAILURE, "Function " + f.name() + " has no arguments: 0");
    if (f.arity() > MAX_FUNCTION_ARITY)
      throw new SolverException(
          ErrorKind.LOWERING_FAILURE,
          "Function " + f.name() + " has too many arguments: " + f.arity());

    final FuncDecl<BitVecSort> decl = batch.declareFunction(f, () -> declare(f));
    final Expr<?>[] args = new Expr<?>[f.arity()];
    for (int i = 0; i < args.length; ++i) args[i] = bv(app, i);
    return (BitVecExpr) ctx.mkApp(decl, args);
  }

  private FuncDecl<BitVecSort> declare(SymFunction f) {
    final Sort[] domain = new Sort[f.arity()];
    for (int i = 0; i < domain.length; ++i) domain[i] = ctx.mkBitVecSort(f.argWidths().get(i));
    return ctx.mkFuncDecl(f.name(), domain, ctx.mkBitVecSort(f.returnWidth()));
  }

  private Quantifier lowerForAll(SymBoolForAll forAll) {
    final List<SymBitVectorVar> vars = forAll.boundVars();
    if (vars.isEmpty() || vars.size() > MAX_BOUND_VARS)
      throw new SolverException(
          ErrorKind.LOWERING_FAILURE,
          "Universal quantification over " + vars.size() + " variables is not supported: "
              + SymSupport.abbreviate(forAll));

    final Expr<?>[] bound = new Expr<?>[vars.size()];
    for (int i = 0; i < bound.length; ++i)
      bound[i] = ctx.mkBVConst(vars.get(i).name(), vars.get(i).width());
    return ctx.mkForall(bound, bool(forAll, 0), 1, null, null, null, null);
  }

  private BoolExpr bool(SymTerm t, int i) {
    return (BoolExpr) batch.loweredOf(t.subTerms().get(i));
  }

  private BitVecExpr bv(SymTerm t, int i) {
    return (BitVecExpr) batch.loweredOf(t.subTerms().get(i));
  }

  private ArrayExpr array(SymTerm t, int i) {
    return (ArrayExpr) batch.loweredOf(t.subTerms().get(i));
  }
}
