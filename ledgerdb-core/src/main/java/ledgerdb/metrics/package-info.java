/**
 * Operation timers reported through {@link ledgerdb.spi.MetricsRecorder}.
 */
package ledgerdb.metrics;
