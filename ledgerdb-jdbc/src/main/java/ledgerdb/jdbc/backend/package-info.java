/**
 * Built-in backends, registered through {@code META-INF/services/ledgerdb.spi.Backend}.
 *
 * <ul>
 *   <li>{@link ledgerdb.jdbc.backend.SqliteBackend}: embedded, write-ahead-log journaling.
 *   <li>{@link ledgerdb.jdbc.backend.PostgresBackend}: networked, serializable isolation.
 *   <li>{@link ledgerdb.jdbc.backend.MySqlBackend}: networked, serializable isolation.
 * </ul>
 *
 * <p>The SQLite driver ships with this module. PostgreSQL and MySQL drivers are optional;
 * without them the backend stays registered but a {@code Database} for its URL fails to open.
 */
package ledgerdb.jdbc.backend;
