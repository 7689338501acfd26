/**
 * Micrometer bridge for exporting operation timings to Prometheus, Grafana, and other backends.
 *
 * <p>{@link ledgerdb.micrometer.MicrometerMetricsRecorder} implements the
 * {@link ledgerdb.spi.MetricsRecorder} SPI using Micrometer timers.
 *
 * @see ledgerdb.micrometer.MicrometerMetricsRecorder
 */
package ledgerdb.micrometer;
