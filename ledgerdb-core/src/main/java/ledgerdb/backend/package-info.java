/**
 * Process-wide backend registry.
 *
 * <p>{@link ledgerdb.backend.Backends} links every registered JDBC driver once per
 * process and resolves the backend for a configured URL.
 */
package ledgerdb.backend;
