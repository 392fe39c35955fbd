package symsat.solver;

import symsat.common.BitVector;
import symsat.symstate.SymBool;

import java.util.List;

/**
 * A decision procedure for conjunctions of {@link SymBool} constraints.
 *
 * <p>Instances are single-threaded. A model obtained by a satisfiable
 * {@link #isSat} call stays queryable until the next {@code isSat} call.
 *
 * <p>The model queries trust the caller: the name and widths passed must be the
 * ones the variable was constrained with. A variable that was never asserted,
 * or that is queried at a different width, yields an arbitrary value.
 */
public interface SmtSolver extends AutoCloseable {

  /**
   * Returns true iff the conjunction of the constraints is satisfiable. On false,
   * {@link #hasError()} tells an unsatisfiable query apart from a failed one.
   */
  boolean isSat(List<? extends SymBool> constraints);

  /** The value of a bit-vector variable; {@code bits} must be a positive multiple of 8. */
  BitVector getModelBv(String var, int bits);

  boolean getModelBool(String var);

  DecodedArray getModelArray(String var, int keyBits, int valueBits);

  boolean hasError();

  String getError();

  ErrorKind getErrorKind();

  /**
   * Asks a running or future {@link #isSat} to stop at its next suspension point.
   * The request stays in force until {@link #clearInterrupt()}.
   */
  void interrupt();

  /** Withdraws an interrupt, so that later {@link #isSat} calls run again. */
  void clearInterrupt();

  @Override
  void close();
}
