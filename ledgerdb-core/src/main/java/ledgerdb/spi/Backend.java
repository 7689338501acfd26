package ledgerdb.spi;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;

/**
 * SPI for a relational backing store reachable through JDBC.
 *
 * <p>Implementations decide how sessions are opened and tuned for their store.
 * Register custom backends via {@code META-INF/services/ledgerdb.spi.Backend}.
 *
 * <p>Built-in backends (module {@code ledgerdb-jdbc}): SQLite, PostgreSQL, MySQL.
 *
 * @see ledgerdb.backend.Backends
 */
public interface Backend {

  /**
   * Unique identifier for this backend (e.g., "sqlite", "postgresql").
   */
  String name();

  /**
   * JDBC URL prefixes this backend handles (e.g., "jdbc:sqlite:").
   */
  List<String> jdbcUrlPrefixes();

  BackendKind kind();

  /**
   * Fully qualified class name of the JDBC driver this backend needs.
   */
  String driverClassName();

  /**
   * Links the JDBC driver. Called once per process by the driver registry.
   *
   * @throws ClassNotFoundException if the driver is not on the classpath
   */
  default void loadDriver() throws ClassNotFoundException {
    Class.forName(driverClassName(), true, getClass().getClassLoader());
  }

  /**
   * Opens a new connection to {@code jdbcUrl}. Callers close it.
   */
  default Connection open(String jdbcUrl) throws SQLException {
    return DriverManager.getConnection(jdbcUrl);
  }

  /**
   * Applies post-open settings to a freshly opened primary connection.
   */
  void tune(Connection connection) throws SQLException;

  /**
   * Applies post-open settings to a connection opened for a pool entry.
   * Defaults to {@link #tune(Connection)}.
   */
  default void tunePoolEntry(Connection connection) throws SQLException {
    tune(connection);
  }

  /**
   * Whether more than one connection can meaningfully be opened to {@code jdbcUrl}.
   * Defaults to {@code true}.
   */
  default boolean supportsPooling(String jdbcUrl) {
    return true;
  }
}
