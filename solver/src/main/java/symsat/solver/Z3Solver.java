package symsat.solver;

import com.microsoft.z3.*;
import com.microsoft.z3.enumerations.Z3_lbool;
import symsat.common.BitVector;
import symsat.symstate.SymAxiomCollector;
import symsat.symstate.SymBool;
import symsat.symstate.SymSupport;
import symsat.symstate.SymTypechecker;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link SmtSolver} backed by Z3.
 *
 * <p>Each {@link #isSat} call closes the constraints under the axioms of the
 * functions they apply, splits top-level conjunctions, then typechecks and lowers
 * each constraint in turn. Side constraints emitted by the lowering are handled
 * the same way in later rounds, until none are left. The abort flag is polled
 * before every constraint and once more before Z3 is called.
 */
public class Z3Solver implements SmtSolver {
  private static final Logger LOG = Logger.getLogger(Z3Solver.class.getName());
  private static final int WINDOW_BITS = 64;

  private final SolverOptions options;
  private final CancellationMonitor monitor;
  private final Context z3;

  private String error;
  private ErrorKind errorKind;
  private Model model;
  private String lastQueryText;
  private String lastQueryHash;

  public Z3Solver() {
    this(SolverOptions.defaults());
  }

  public Z3Solver(SolverOptions options) {
    this(options, new CancellationMonitor());
  }

  public Z3Solver(SolverOptions options, CancellationMonitor monitor) {
    this.options = options;
    this.monitor = monitor;
    this.z3 = SolverSupport.mkContext();
  }

  @Override
  public boolean isSat(List<? extends SymBool> constraints) {
    SolverStatistics.recordQuery();
    error = null;
    errorKind = null;
    model = null;

    try {
      final List<SymBool> atoms =
          SymSupport.flattenConjunctions(SymAxiomCollector.close(constraints));
      final QueryBatch batch = new QueryBatch(atoms);
      final Z3Lowering lowering = new Z3Lowering(z3, batch);
      final SymTypechecker typechecker = new SymTypechecker();
      LOG.fine(() -> "Checking " + atoms.size() + " constraints");

      while (batch.hasPending()) {
        checkAbort();
        for (SymBool constraint : batch.pending()) {
          checkAbort();

          long start = System.nanoTime();
          final boolean welltyped = typechecker.check(constraint);
          SolverStatistics.recordTypecheck(System.nanoTime() - start);
          if (!welltyped)
            throw new SolverException(
                ErrorKind.TYPECHECK_FAILURE,
                "Typechecking failed for constraint: " + SymSupport.abbreviate(constraint)
                    + "\nerror: " + typechecker.error() + "\n");

          start = System.nanoTime();
          batch.addLowered(lowering.lower(constraint));
          SolverStatistics.recordLowering(System.nanoTime() - start);
        }
        batch.nextRound();
      }
      checkAbort();

      LOG.fine(
          () -> "Lowered " + batch.lowered().size() + " assertions (" + batch.numLoweredTerms()
              + " terms, " + batch.numFunctions() + " functions) in " + batch.round() + " rounds");
      return solve(batch.lowered());

    } catch (SolverException ex) {
      setError(ex.kind(), ex.getMessage());
      return false;
    } catch (Z3Exception ex) {
      setError(ErrorKind.SOLVER_FAULT, "Z3 encountered error: " + ex.getMessage() + "\n");
      return false;
    } catch (RuntimeException ex) {
      LOG.log(Level.WARNING, "solver procedure failed", ex);
      setError(ErrorKind.SOLVER_FAULT, "Z3 encountered error: " + ex + "\n");
      return false;
    }
  }

  private boolean solve(List<BoolExpr> assertions) {
    final Solver solver = z3.mkSolver();
    if (options.timeoutMs() > 0) {
      final Params params = z3.mkParams();
      params.add("timeout", options.timeoutMs());
      solver.setParameters(params);
    }
    solver.add(assertions.toArray(new BoolExpr[0]));
    recordQuery(solver);

    final long start = System.nanoTime();
    final Status status = solver.check();
    SolverStatistics.recordSolving(System.nanoTime() - start);

    switch (status) {
      case UNSATISFIABLE:
        return false;
      case SATISFIABLE:
        model = solver.getModel();
        LOG.fine(() -> "Model:\n" + model);
        return true;
      case UNKNOWN:
        LOG.fine(() -> "Z3 returned unknown: " + solver.getReasonUnknown());
        throw new SolverException(ErrorKind.SOLVER_INDETERMINATE, "z3 gave up.");
      default:
        throw new AssertionError("unexpected Z3 status: " + status);
    }
  }

  private void recordQuery(Solver solver) {
    if (!options.dumpQueries() && !options.recordLastQuery()) return;

    final String smtlib = solver.toString();
    if (options.dumpQueries()) {
      final Path file = SolverSupport.dumpQuery(options.dumpDir(), smtlib);
      LOG.info("Dumped query to " + file);
    }
    if (options.recordLastQuery()) {
      lastQueryText = smtlib;
      lastQueryHash = SolverSupport.hashQuery(smtlib);
    }
  }

  private void checkAbort() {
    if (monitor.isStopRequested())
      throw new SolverException(ErrorKind.EXTERNAL_INTERRUPT, "External interrupt.");
  }

  @Override
  public BitVector getModelBv(String var, int bits) {
    checkArgument(bits > 0 && bits % 8 == 0, "bit width must be a positive multiple of 8: %s", bits);
    final Model m = requireModel();

    final BitVecExpr bv = z3.mkBVConst(var, bits);
    final BitVector result = new BitVector(bits);
    for (int lo = 0; lo < bits; lo += WINDOW_BITS) {
      final int hi = Math.min(lo + WINDOW_BITS, bits) - 1;
      final Expr<?> window = m.eval(z3.mkExtract(hi, lo, bv), true);
      if (!(window instanceof BitVecNum))
        throw modelQueryError("Z3 returned non-numeral " + window + " for bit-vector var " + var + ".");

      final long value = ((BitVecNum) window).getBigInteger().longValue();
      for (int i = 0; i < (hi - lo + 1) / 8; ++i)
        result.setFixedByte(lo / 8 + i, (int) (value >>> (8 * i)) & 0xff);
    }
    return result;
  }

  @Override
  public boolean getModelBool(String var) {
    final Model m = requireModel();
    return decodeBool(var, m.eval(z3.mkBoolConst(var), true));
  }

  boolean decodeBool(String var, Expr<?> value) {
    final Z3_lbool b = value.getBoolValue();
    switch (b) {
      case Z3_L_TRUE:
        return true;
      case Z3_L_FALSE:
        return false;
      default:
        throw modelQueryError("Z3 returned invalid value " + b.toInt() + " for boolean " + var + ".");
    }
  }

  @Override
  public DecodedArray getModelArray(String var, int keyBits, int valueBits) {
    checkArgument(keyBits > 0 && keyBits <= 64, "array keys must be 1 to 64 bits: %s", keyBits);
    checkArgument(valueBits == 8, "array values must be bytes: %s", valueBits);
    final Model m = requireModel();
    try {
      return new ArrayModelDecoder(z3, m).decode(var, keyBits, valueBits);
    } catch (SolverException ex) {
      setError(ex.kind(), ex.getMessage());
      throw ex;
    }
  }

  private Model requireModel() {
    if (model == null)
      throw new IllegalStateException("no model: the last query was not satisfiable");
    return model;
  }

  private SolverException modelQueryError(String msg) {
    setError(ErrorKind.MODEL_QUERY_ERROR, msg);
    return new SolverException(ErrorKind.MODEL_QUERY_ERROR, msg);
  }

  private void setError(ErrorKind kind, String msg) {
    errorKind = kind;
    error = msg;
    LOG.log(kind == ErrorKind.EXTERNAL_INTERRUPT ? Level.FINE : Level.WARNING, msg);
  }

  @Override
  public boolean hasError() {
    return error != null;
  }

  @Override
  public String getError() {
    return error;
  }

  @Override
  public ErrorKind getErrorKind() {
    return errorKind;
  }

  @Override
  public void interrupt() {
    monitor.requestStop();
  }

  @Override
  public void clearInterrupt() {
    monitor.clear();
  }

  String lastQueryText() {
    return lastQueryText;
  }

  String lastQueryHash() {
    return lastQueryHash;
  }

  Context context() {
    return z3;
  }

  Model model() {
    return model;
  }

  @Override
  public void close() {
    model = null;
    z3.close();
  }
}
