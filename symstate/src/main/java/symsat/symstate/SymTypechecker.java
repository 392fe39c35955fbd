package symsat.symstate;

import com.google.common.collect.Sets;

import java.util.*;

import static symsat.symstate.SymSupport.abbreviate;

/**
 * Checks that widths and sorts agree across every sub-term of a constraint.
 *
 * <p>A checker may be reused for several constraints of one query; nodes that
 * were already checked are skipped. Only the first error is kept.
 */
public class SymTypechecker {
  private final Set<SymTerm> checked = Sets.newIdentityHashSet();
  private final Map<String, String> varSorts = new HashMap<>();
  private String error;

  /** Returns whether the constraint is well-typed. */
  public boolean check(SymBool constraint) {
    final Deque<SymTerm> worklist = new ArrayDeque<>();
    worklist.push(constraint);
    while (!worklist.isEmpty()) {
      final SymTerm term = worklist.pop();
      if (!checked.add(term)) continue;

      final String msg = checkNode(term);
      if (msg != null) {
        if (error == null) error = msg;
        return false;
      }
      for (SymTerm sub : term.subTerms()) worklist.push(sub);
    }
    return true;
  }

  public boolean hasError() {
    return error != null;
  }

  public String error() {
    return error;
  }

  private String checkNode(SymTerm term) {
    final SymKind kind = term.kind();
    switch (kind) {
      case TRUE, FALSE, NOT, AND, OR, XOR, IFF, IMPLIES:
        return null;

      case BOOL_VAR:
        return checkVarSort(((SymBoolVar) term).name(), "Bool");

      case EQ, LT, LE, GT, GE, SIGN_LT, SIGN_LE, SIGN_GT, SIGN_GE: {
        final SymBoolCompare cmp = (SymBoolCompare) term;
        return checkSameWidth(term, cmp.a().width(), cmp.b().width());
      }

      case ARRAY_EQ: {
        final SymBoolArrayEq eq = (SymBoolArrayEq) term;
        if (eq.a().keyWidth() != eq.b().keyWidth() || eq.a().valueWidth() != eq.b().valueWidth())
          return "array sorts differ in " + abbreviate(term) + ": " + arraySort(eq.a()) + " vs "
              + arraySort(eq.b());
        return null;
      }

      case FOR_ALL: {
        final List<SymBitVectorVar> vars = ((SymBoolForAll) term).boundVars();
        final Set<String> names = new HashSet<>();
        for (SymBitVectorVar var : vars) {
          if (!names.add(var.name()))
            return "variable " + var.name() + " is bound twice in " + abbreviate(term);
          final String msg = checkNode(var);
          if (msg != null) return msg;
        }
        return null;
      }

      case BV_CONSTANT:
        return checkPositive(term, ((SymBitVector) term).width());

      case BV_VAR: {
        final SymBitVectorVar var = (SymBitVectorVar) term;
        final String msg = checkPositive(term, var.width());
        return msg != null ? msg : checkVarSort(var.name(), bvSort(var.width()));
      }

      case BV_NOT, BV_UMINUS:
        return null;

      case BV_AND, BV_OR, BV_XOR, BV_PLUS, BV_MINUS, BV_MULT, BV_DIV, BV_MOD,
          BV_SIGN_DIV, BV_SIGN_MOD, BV_SHIFT_LEFT, BV_SHIFT_RIGHT, BV_SIGN_SHIFT_RIGHT,
          BV_ROTATE_LEFT, BV_ROTATE_RIGHT: {
        final SymBitVectorBinary bin = (SymBitVectorBinary) term;
        return checkSameWidth(term, bin.a().width(), bin.b().width());
      }

      case BV_CONCAT:
        return null;

      case BV_EXTRACT: {
        final SymBitVectorExtract ext = (SymBitVectorExtract) term;
        final int width = ext.operand().width();
        if (ext.lowBit() < 0 || ext.lowBit() > ext.highBit() || ext.highBit() >= width)
          return "extract [" + ext.highBit() + ":" + ext.lowBit() + "] out of range for width "
              + width + " in " + abbreviate(term);
        return null;
      }

      case BV_SIGN_EXTEND: {
        final SymBitVectorSignExtend ext = (SymBitVectorSignExtend) term;
        if (ext.width() < ext.operand().width())
          return "sign extension of width " + ext.operand().width() + " to narrower width "
              + ext.width() + " in " + abbreviate(term);
        return null;
      }

      case BV_ITE: {
        final SymBitVectorIte ite = (SymBitVectorIte) term;
        return checkSameWidth(term, ite.a().width(), ite.b().width());
      }

      case BV_FUNCTION: {
        final SymBitVectorFunction app = (SymBitVectorFunction) term;
        final SymFunction f = app.function();
        if (app.args().size() != f.arity())
          return "function " + f.name() + " expects " + f.arity() + " arguments but got "
              + app.args().size() + " in " + abbreviate(term);
        for (int i = 0; i < f.arity(); ++i) {
          final int declared = f.argWidths().get(i);
          if (declared <= 0) return "function " + f.name() + " declares non-positive width " + declared;
          if (app.args().get(i).width() != declared)
            return "argument " + i + " of function " + f.name() + " has width "
                + app.args().get(i).width() + " but " + declared + " is declared, in " + abbreviate(term);
        }
        return checkPositive(term, f.returnWidth());
      }

      case BV_ARRAY_LOOKUP: {
        final SymBitVectorArrayLookup lookup = (SymBitVectorArrayLookup) term;
        if (lookup.key().width() != lookup.array().keyWidth())
          return "key of width " + lookup.key().width() + " used on " + arraySort(lookup.array())
              + " in " + abbreviate(term);
        return null;
      }

      case ARRAY_VAR: {
        final SymArrayVar var = (SymArrayVar) term;
        if (var.keyWidth() <= 0 || var.valueWidth() <= 0)
          return "array " + var.name() + " has non-positive sort " + arraySort(var);
        return checkVarSort(var.name(), arraySort(var));
      }

      case ARRAY_STORE: {
        final SymArrayStore store = (SymArrayStore) term;
        if (store.key().width() != store.array().keyWidth()
            || store.value().width() != store.array().valueWidth())
          return "store of " + bvSort(store.key().width()) + " -> " + bvSort(store.value().width())
              + " into " + arraySort(store.array()) + " in " + abbreviate(term);
        return null;
      }

      default:
        throw new AssertionError("unknown term kind: " + kind);
    }
  }

  private String checkVarSort(String name, String sort) {
    final String previous = varSorts.putIfAbsent(name, sort);
    if (previous != null && !previous.equals(sort))
      return "variable " + name + " is used as both " + previous + " and " + sort;
    return null;
  }

  private static String checkSameWidth(SymTerm term, int w0, int w1) {
    return w0 == w1 ? null : "width mismatch (" + w0 + " vs " + w1 + ") in " + abbreviate(term);
  }

  private static String checkPositive(SymTerm term, int width) {
    return width > 0 ? null : "non-positive width " + width + " in " + abbreviate(term);
  }

  private static String bvSort(int width) {
    return "(_ BitVec " + width + ")";
  }

  private static String arraySort(SymArray array) {
    return "(Array " + bvSort(array.keyWidth()) + " " + bvSort(array.valueWidth()) + ")";
  }
}
