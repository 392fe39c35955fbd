package symsat.solver;

/** A per-query failure. {@link Z3Solver#isSat} turns these into its last-error slot. */
public class SolverException extends RuntimeException {
  private final ErrorKind kind;

  public SolverException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
