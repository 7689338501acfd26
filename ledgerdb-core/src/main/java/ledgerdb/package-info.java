/**
 * Session and access-path management for a relational ledger store.
 *
 * <p>{@link ledgerdb.Database} owns the primary session and hands out prepared
 * statements, pooled sessions, SQL captures and operation timers. Failures
 * surface as subclasses of {@link ledgerdb.LedgerDbException}.
 *
 * @see ledgerdb.Database
 */
package ledgerdb;
