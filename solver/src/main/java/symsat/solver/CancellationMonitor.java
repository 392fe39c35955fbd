package symsat.solver;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A stop flag that may be raised from any thread. Solvers sample it before
 * lowering, before each atomic constraint and right before invoking the
 * decision procedure; a running check is not preempted.
 *
 * <p>Solvers never lower the flag. Whoever raised it calls {@link #clear()}.
 */
public class CancellationMonitor {
  private final AtomicBoolean stopNow = new AtomicBoolean(false);

  public void requestStop() {
    stopNow.set(true);
  }

  public void clear() {
    stopNow.set(false);
  }

  public boolean isStopRequested() {
    return stopNow.get();
  }
}
