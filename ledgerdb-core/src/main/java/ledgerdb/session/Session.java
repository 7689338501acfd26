package ledgerdb.session;

import ledgerdb.ConnectionException;
import ledgerdb.QueryException;
import ledgerdb.spi.Backend;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open, tuned JDBC connection to the backing store, together with its
 * {@link StatementCache} and SQL capture slot.
 *
 * <p>Every statement executed through the session ({@link #execute(String)} or a
 * {@link StatementHandle} from {@link #prepare(String)}) is written to the query
 * trace, which is only observed while a {@link SqlCapture} is attached.
 *
 * <p>A session is not internally synchronised: callers must not issue
 * statements on it from several threads at once. Statement checkouts are the
 * exception; they serialise on their own.
 */
public final class Session implements AutoCloseable {
  private final String name;
  private final Backend backend;
  private final Connection connection;
  private final StatementCache statements;
  private final AtomicReference<SqlCapture> capture = new AtomicReference<>();
  private volatile boolean closed;

  private Session(String name, Backend backend, Connection connection) {
    this.name = name;
    this.backend = backend;
    this.connection = connection;
    this.statements = new StatementCache(this);
  }

  /**
   * Opens a connection through {@code backend} and applies its post-open tuning.
   *
   * @param backend backend resolved for {@code jdbcUrl}
   * @param jdbcUrl the JDBC URL
   * @param name    session name used in logs and error messages
   * @return the open session
   * @throws ConnectionException if the connection cannot be opened or tuned
   */
  public static Session open(Backend backend, String jdbcUrl, String name) {
    return open(backend, jdbcUrl, name, false);
  }

  /**
   * Opens a pool entry connection through {@code backend}, tuned with
   * {@link Backend#tunePoolEntry(Connection)}.
   *
   * @throws ConnectionException if the connection cannot be opened or tuned
   */
  public static Session openPoolEntry(Backend backend, String jdbcUrl, String name) {
    return open(backend, jdbcUrl, name, true);
  }

  private static Session open(Backend backend, String jdbcUrl, String name, boolean poolEntry) {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    Objects.requireNonNull(name, "name");

    Connection connection;
    try {
      connection = backend.open(jdbcUrl);
    } catch (SQLException e) {
      throw new ConnectionException("Failed to open session " + name + " to " + jdbcUrl, e);
    }
    try {
      if (poolEntry) {
        backend.tunePoolEntry(connection);
      } else {
        backend.tune(connection);
      }
    } catch (SQLException e) {
      ConnectionException failure =
          new ConnectionException("Failed to tune session " + name + " on " + backend.name(), e);
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        failure.addSuppressed(closeFailure);
      }
      throw failure;
    }
    return new Session(name, backend, connection);
  }

  public String name() {
    return name;
  }

  public Backend backend() {
    return backend;
  }

  /**
   * The underlying connection. Statements issued on it directly bypass the
   * query trace.
   */
  public Connection connection() {
    ensureOpen();
    return connection;
  }

  public StatementCache statements() {
    return statements;
  }

  /**
   * Checks out the cached prepared statement for {@code sql}, preparing it on
   * first use.
   *
   * @see StatementCache#checkout(String)
   */
  public StatementHandle prepare(String sql) {
    ensureOpen();
    return statements.checkout(sql);
  }

  /**
   * Executes a one-off, unprepared statement.
   *
   * @throws QueryException if execution fails
   */
  public void execute(String sql) {
    Objects.requireNonNull(sql, "sql");
    ensureOpen();
    trace(sql);
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException e) {
      throw new QueryException("Failed to execute: " + sql, e);
    }
  }

  /**
   * Starts capturing the query trace of this session. Close the returned
   * capture to detach it and log what was captured.
   *
   * @param captureName label written around the captured lines
   * @throws IllegalStateException if a capture is already active on this session
   */
  public SqlCapture captureSql(String captureName) {
    Objects.requireNonNull(captureName, "captureName");
    ensureOpen();
    SqlCapture created = new SqlCapture(captureName, this);
    SqlCapture active = capture.compareAndExchange(null, created);
    if (active != null) {
      throw new IllegalStateException("SQL capture '" + active.name()
          + "' is already active on session " + name);
    }
    return created;
  }

  /**
   * Whether a {@link SqlCapture} is currently attached.
   */
  public boolean isCapturing() {
    return capture.get() != null;
  }

  public boolean isClosed() {
    return closed;
  }

  void trace(String sql) {
    SqlCapture active = capture.get();
    if (active != null) {
      active.append(sql);
    }
  }

  void detach(SqlCapture sqlCapture) {
    capture.compareAndSet(sqlCapture, null);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session " + name + " has been closed");
    }
  }

  /**
   * Closes every cached statement, then the connection. Subsequent calls are no-ops.
   *
   * @throws ConnectionException if the connection fails to close
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    try {
      statements.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      ConnectionException failure = new ConnectionException("Failed to close session " + name, e);
      if (first != null) {
        failure.addSuppressed(first);
      }
      first = failure;
    }
    if (first != null) {
      throw first;
    }
  }

  @Override
  public String toString() {
    return "Session[" + name + ", " + backend.name() + "]";
  }
}
