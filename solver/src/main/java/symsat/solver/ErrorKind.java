package symsat.solver;

public enum ErrorKind {
  TYPECHECK_FAILURE,
  LOWERING_FAILURE,
  EXTERNAL_INTERRUPT,
  SOLVER_INDETERMINATE,
  SOLVER_FAULT,
  MODEL_QUERY_ERROR
}
