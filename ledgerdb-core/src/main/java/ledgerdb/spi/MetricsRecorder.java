package ledgerdb.spi;

import java.time.Duration;

/**
 * Observability hook receiving operation durations.
 *
 * <p>The {@link #NOOP} instance discards all samples. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsRecorder {

  /**
   * No-op instance that discards all samples.
   */
  MetricsRecorder NOOP = (key, elapsed) -> {
  };

  /**
   * Records one elapsed-time sample.
   *
   * @param key     metric key
   * @param elapsed elapsed time (never negative)
   */
  void recordDuration(TimerKey key, Duration elapsed);
}
