package ledgerdb.metrics;

import ledgerdb.spi.MetricsRecorder;
import ledgerdb.spi.TimerKey;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scope that records how long a database operation took.
 *
 * <p>Use via try-with-resources; exactly one sample is recorded when the scope
 * closes, whether the wrapped operation completed or threw:
 * <pre>{@code
 * try (OperationTimer timer = database.getSelectTimer("account")) {
 *     loadAccount(...);
 * }
 * }</pre>
 *
 * <p>Recording failures are logged and never propagate into the wrapped operation.
 */
public final class OperationTimer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OperationTimer.class.getName());

  private final MetricsRecorder recorder;
  private final TimerKey key;
  private final long startNanos;
  private boolean closed;

  public OperationTimer(MetricsRecorder recorder, TimerKey key) {
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.key = Objects.requireNonNull(key, "key");
    this.startNanos = System.nanoTime();
  }

  public TimerKey key() {
    return key;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    Duration elapsed = Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
    try {
      recorder.recordDuration(key, elapsed);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record timer " + key, e);
    }
  }
}
