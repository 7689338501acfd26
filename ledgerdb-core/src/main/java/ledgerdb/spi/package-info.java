/**
 * Service Provider Interfaces (SPI) for extending ledgerdb.
 *
 * <p>These interfaces define the extension points integrators implement to plug
 * in backing stores, metrics and schema-owning components.
 *
 * @see ledgerdb.spi.Backend
 * @see ledgerdb.spi.MetricsRecorder
 * @see ledgerdb.spi.SchemaOwner
 */
package ledgerdb.spi;
