package ledgerdb.jdbc.backend;

import ledgerdb.spi.BackendKind;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SQLite backend (embedded).
 *
 * <p>The primary session is switched to write-ahead-log journaling on open;
 * pool entries keep the journal mode of the file. Private
 * in-memory stores ({@code jdbc:sqlite::memory:}, {@code jdbc:sqlite:} without a
 * path, and memory URIs without {@code cache=shared}) are visible to one
 * connection only and cannot be pooled.
 */
public final class SqliteBackend extends AbstractBackend {
  private static final Logger logger = Logger.getLogger(SqliteBackend.class.getName());

  static final String PREFIX = "jdbc:sqlite:";

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of(PREFIX);
  }

  @Override
  public BackendKind kind() {
    return BackendKind.EMBEDDED;
  }

  @Override
  public String driverClassName() {
    return "org.sqlite.JDBC";
  }

  @Override
  protected void enableJournaling(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("PRAGMA journal_mode = WAL")) {
      if (rs.next()) {
        logger.log(Level.FINE, "SQLite journal mode: {0}", rs.getString(1));
      }
    }
  }

  @Override
  public boolean supportsPooling(String jdbcUrl) {
    String target = jdbcUrl.startsWith(PREFIX) ? jdbcUrl.substring(PREFIX.length()) : jdbcUrl;
    if (target.isEmpty() || target.startsWith(":memory:")) {
      return false;
    }
    boolean memoryUri = target.startsWith("file::memory:") || target.contains("mode=memory");
    return !memoryUri || target.contains("cache=shared");
  }
}
