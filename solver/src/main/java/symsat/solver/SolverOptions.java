package symsat.solver;

import java.nio.file.Path;

/**
 * Solver configuration. {@link #fromSystemProperties()} reads:
 *
 * <ul>
 *   <li>{@value #TIMEOUT_PROPERTY}: per-check timeout in ms, 0 for none
 *   <li>{@value #DUMP_QUERIES_PROPERTY}: write every lowered query as SMT-LIB2
 *   <li>{@value #DUMP_DIR_PROPERTY}: where dumped queries go
 *   <li>{@value #RECORD_LAST_QUERY_PROPERTY}: keep the last query text and hash
 * </ul>
 */
public final class SolverOptions {
  public static final String TIMEOUT_PROPERTY = "symsat.smt_timeout";
  public static final String DUMP_QUERIES_PROPERTY = "symsat.dump_queries";
  public static final String DUMP_DIR_PROPERTY = "symsat.dump_dir";
  public static final String RECORD_LAST_QUERY_PROPERTY = "symsat.record_last_query";

  private final int timeoutMs;
  private final boolean dumpQueries;
  private final Path dumpDir;
  private final boolean recordLastQuery;

  private SolverOptions(int timeoutMs, boolean dumpQueries, Path dumpDir, boolean recordLastQuery) {
    if (timeoutMs < 0) throw new IllegalArgumentException("negative timeout: " + timeoutMs);
    this.timeoutMs = timeoutMs;
    this.dumpQueries = dumpQueries;
    this.dumpDir = dumpDir;
    this.recordLastQuery = recordLastQuery;
  }

  public static SolverOptions defaults() {
    return new SolverOptions(0, false, Path.of("."), false);
  }

  public static SolverOptions fromSystemProperties() {
    return new SolverOptions(
        Integer.getInteger(TIMEOUT_PROPERTY, 0),
        Boolean.getBoolean(DUMP_QUERIES_PROPERTY),
        Path.of(System.getProperty(DUMP_DIR_PROPERTY, ".")),
        Boolean.getBoolean(RECORD_LAST_QUERY_PROPERTY));
  }

  public SolverOptions withTimeout(int timeoutMs) {
    return new SolverOptions(timeoutMs, dumpQueries, dumpDir, recordLastQuery);
  }

  public SolverOptions withDumpQueries(Path dumpDir) {
    return new SolverOptions(timeoutMs, true, dumpDir, recordLastQuery);
  }

  public SolverOptions withRecordLastQuery(boolean recordLastQuery) {
    return new SolverOptions(timeoutMs, dumpQueries, dumpDir, recordLastQuery);
  }

  public int timeoutMs() {
    return timeoutMs;
  }

  public boolean dumpQueries() {
    return dumpQueries;
  }

  public Path dumpDir() {
    return dumpDir;
  }

  public boolean recordLastQuery() {
    return recordLastQuery;
  }

  @Override
  public String toString() {
    return "SolverOptions{timeout=" + timeoutMs + "ms, dumpQueries=" + dumpQueries
        + ", dumpDir=" + dumpDir + ", recordLastQuery=" + recordLastQuery + "}";
  }
}
