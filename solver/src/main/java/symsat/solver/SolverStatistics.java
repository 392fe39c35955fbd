package symsat.solver;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/** Process-wide counters over every solver instance. */
public abstract class SolverStatistics {
  private static final AtomicLong NUM_QUERIES = new AtomicLong();
  private static final AtomicLong NUM_CONSTRAINTS = new AtomicLong();
  private static final AtomicLong TYPECHECK_NANOS = new AtomicLong();
  private static final AtomicLong LOWERING_NANOS = new AtomicLong();
  private static final AtomicLong SOLVER_NANOS = new AtomicLong();

  private SolverStatistics() {}

  static void recordQuery() {
    NUM_QUERIES.incrementAndGet();
  }

  static void recordTypecheck(long nanos) {
    NUM_CONSTRAINTS.incrementAndGet();
    TYPECHECK_NANOS.addAndGet(nanos);
  }

  static void recordLowering(long nanos) {
    LOWERING_NANOS.addAndGet(nanos);
  }

  static void recordSolving(long nanos) {
    SOLVER_NANOS.addAndGet(nanos);
  }

  public static long numQueries() {
    return NUM_QUERIES.get();
  }

  public static long numConstraints() {
    return NUM_CONSTRAINTS.get();
  }

  public static long typecheckNanos() {
    return TYPECHECK_NANOS.get();
  }

  public static long loweringNanos() {
    return LOWERING_NANOS.get();
  }

  public static long solverNanos() {
    return SOLVER_NANOS.get();
  }

  public static void reset() {
    NUM_QUERIES.set(0);
    NUM_CONSTRAINTS.set(0);
    TYPECHECK_NANOS.set(0);
    LOWERING_NANOS.set(0);
    SOLVER_NANOS.set(0);
  }

  public static String summary() {
    return String.format(
        "queries=%d constraints=%d typecheck=%dms lowering=%dms solving=%dms",
        numQueries(),
        numConstraints(),
        TimeUnit.NANOSECONDS.toMillis(typecheckNanos()),
        TimeUnit.NANOSECONDS.toMillis(loweringNanos()),
        TimeUnit.NANOSECONDS.toMillis(solverNanos()));
  }
}
