package symsat.solver;

import com.microsoft.z3.*;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import static symsat.solver.ArrayModelShape.STORE_CHAIN;

/**
 * Reads a {@link DecodedArray} out of the model value of an array variable.
 *
 * <p>Store chains are peeled from the outside in; the outermost store of an
 * address shadows any store below it. The base of the chain decides the default
 * byte and may add more explicit addresses. A base that cannot be read
 * yields an empty, zero-default array: the memory may simply not matter for the
 * query, but a counterexample built from it has to be checked independently.
 */
class ArrayModelDecoder {
  private static final Logger LOG = Logger.getLogger(ArrayModelDecoder.class.getName());

  private final Context ctx;
  private final Model model;

  ArrayModelDecoder(Context ctx, Model model) {
    this.ctx = ctx;
    this.model = model;
  }

  DecodedArray decode(String var, int keyBits, int valueBits) {
    final ArrayExpr<BitVecSort, BitVecSort> array =
        ctx.mkArrayConst(var, ctx.mkBitVecSort(keyBits), ctx.mkBitVecSort(valueBits));
    final Expr<?> value = model.eval(array, true);
    LOG.fine(() -> "Expression for array model of " + var + ": " + value);
    return decode(value);
  }

  DecodedArray decode(Expr<?> value) {
    final Map<Long, Integer> contents = new TreeMap<>(Long::compareUnsigned);

    Expr<?> e = value;
    ArrayModelShape shape = ArrayModelShape.of(e);
    while (shape == STORE_CHAIN) {
      final Expr<?>[] args = e.getArgs();
      final Pair<Long, Integer> entry = readEntry(args[1], args[2]);
      if (entry == null) return unparseable(value);
      contents.putIfAbsent(entry.getKey(), entry.getValue());

      e = args[0];
      shape = ArrayModelShape.of(e);
    }

    return switch (shape) {
      case STORE_CHAIN -> throw new AssertionError("store chain not fully peeled");
      case CONSTANT_ARRAY -> decodeConstantArray(e, contents);
      case FUNCTION_INTERPRETATION -> decodeFunctionInterpretation(e, contents);
      case ARRAY_MAP -> decodeArrayMap(value);
      case UNPARSEABLE -> unparseable(value);
    };
  }

  private DecodedArray decodeConstantArray(Expr<?> e, Map<Long, Integer> contents) {
    final Expr<?> fill = e.getArgs()[0];
    if (!(fill instanceof BitVecNum)) return unparseable(e);
    return new DecodedArray(contents, readByte(fill, "default"));
  }

  private DecodedArray decodeFunctionInterpretation(Expr<?> e, Map<Long, Integer> contents) {
    final FuncDecl<?> function = e.getFuncDecl().getParameters()[0].getFuncDecl();
    final FuncInterp<?> interp = model.getFuncInterp(function);
    if (interp == null) return unparseable(e);

    for (FuncInterp.Entry<?> funcEntry : interp.getEntries()) {
      final Pair<Long, Integer> entry = readEntry(funcEntry.getArgs()[0], funcEntry.getValue());
      if (entry == null) return unparseable(e);
      contents.putIfAbsent(entry.getKey(), entry.getValue());
    }

    // a compacted interpretation folds its points into (ite (= x!0 k) v else)
    Expr<?> otherwise = interp.getElse();
    while (otherwise.isITE()) {
      final Expr<?>[] ite = otherwise.getArgs();
      final Expr<?> key = pointKey(ite[0]);
      final Pair<Long, Integer> entry = key == null ? null : readEntry(key, ite[1]);
      if (entry == null) return unparseable(e);
      contents.putIfAbsent(entry.getKey(), entry.getValue());
      otherwise = ite[2];
    }

    if (!(otherwise instanceof BitVecNum)) return unparseable(e);
    return new DecodedArray(contents, readByte(otherwise, "default"));
  }

  /** k for a condition {@code (= x!0 k)} over the bound argument, else null. */
  private static Expr<?> pointKey(Expr<?> cond) {
    if (!cond.isEq() || cond.getNumArgs() != 2) return null;
    final Expr<?>[] sides = cond.getArgs();
    if (sides[0].isVar()) return sides[1];
    if (sides[1].isVar()) return sides[0];
    return null;
  }

  private DecodedArray decodeArrayMap(Expr<?> e) {
    LOG.warning("[z3] Don't know how to handle array map: " + e);
    return unparseable(e);
  }

  private DecodedArray unparseable(Expr<?> e) {
    LOG.warning("[z3] Couldn't parse Z3's AST for array model; may have spurious CEG: " + e);
    return DecodedArray.empty();
  }

  /** (address, byte), or null if either side is not a numeral. */
  private Pair<Long, Integer> readEntry(Expr<?> key, Expr<?> value) {
    if (!(key instanceof BitVecNum) || !(value instanceof BitVecNum)) return null;
    final long address = ((BitVecNum) key).getBigInteger().longValue();
    return Pair.of(address, readByte(value, Long.toUnsignedString(address, 16)));
  }

  private static int readByte(Expr<?> value, String where) {
    final BigInteger v = ((BitVecNum) value).getBigInteger();
    if (v.signum() < 0 || v.bitLength() > 8)
      throw new SolverException(
          ErrorKind.MODEL_QUERY_ERROR,
          "Z3 returned value " + v + " at " + where + " of an array model, which is not a byte.");
    return v.intValue();
  }
}
