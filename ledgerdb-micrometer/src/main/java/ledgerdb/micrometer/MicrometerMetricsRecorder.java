package ledgerdb.micrometer;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import ledgerdb.spi.MetricsRecorder;
import ledgerdb.spi.TimerKey;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsRecorder}.
 *
 * <p>Each {@link TimerKey} maps to one {@link Timer} registered with the
 * {@link MeterRegistry} on its first sample:
 * <ul>
 *   <li>name {@code <prefix>.<category>}, e.g. {@code database.select}</li>
 *   <li>tag {@code entity=<entityName>}, e.g. {@code entity=account}</li>
 * </ul>
 *
 * @see MetricsRecorder
 */
public final class MicrometerMetricsRecorder implements MetricsRecorder, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<TimerKey, Timer> timers = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates a recorder with the default metric name prefix {@code "database"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsRecorder(MeterRegistry registry) {
    this(registry, "database");
  }

  /**
   * Creates a recorder with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all timer names (e.g. {@code "ledger.primary"})
   */
  public MicrometerMetricsRecorder(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordDuration(TimerKey key, Duration elapsed) {
    if (closed) return;
    timers.computeIfAbsent(key, this::register).record(elapsed);
  }

  private Timer register(TimerKey key) {
    return Timer.builder(namePrefix + "." + key.category().key())
        .description("Duration of " + key.category().key() + " operations")
        .tag("entity", key.entityName())
        .register(registry);
  }

  /**
   * Removes every timer registered by this recorder from the registry. Later
   * samples are dropped.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.copyOf(timers.values())) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    timers.clear();
    if (first != null) throw first;
  }
}
