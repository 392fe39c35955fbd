package symsat.solver;

import com.google.common.hash.Hashing;
import com.microsoft.z3.Context;
import com.microsoft.z3.Global;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogManager;

public abstract class SolverSupport {
  private static final String LOGGER_CONFIG =
      ".level = %1$s\n"
          + "java.util.logging.ConsoleHandler.level = %1$s\n"
          + "handlers=java.util.logging.ConsoleHandler\n"
          + "java.util.logging.ConsoleHandler.formatter=java.util.logging.SimpleFormatter\n"
          + "java.util.logging.SimpleFormatter.format=[%%1$tm/%%1$td %%1$tT][%%3$10s][%%4$s] %%5$s %%n\n";

  private static final AtomicInteger NUM_DUMPS = new AtomicInteger(0);

  static {
    // fixed seeds keep models reproducible across runs
    Global.setParameter("smt.random_seed", "0");
    Global.setParameter("sat.random_seed", "0");
  }

  private SolverSupport() {}

  static Context mkContext() {
    return new Context();
  }

  /** Routes every logger to the console at the given level. */
  public static void configureLogging(Level level) {
    final String config = String.format(LOGGER_CONFIG, level.getName());
    try {
      LogManager.getLogManager()
          .readConfiguration(new ByteArrayInputStream(config.getBytes(StandardCharsets.UTF_8)));
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  /** Writes one query to {@code <dir>/z3-smtlib-<n>.smt2} and returns the file. */
  static Path dumpQuery(Path dir, String smtlib) {
    final Path file = dir.resolve("z3-smtlib-" + NUM_DUMPS.getAndIncrement() + ".smt2");
    try {
      Files.createDirectories(dir);
      Files.writeString(file, smtlib + "\n", StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return file;
  }

  static String hashQuery(String smtlib) {
    return Hashing.sha256().hashString(smtlib, StandardCharsets.UTF_8).toString();
  }
}
