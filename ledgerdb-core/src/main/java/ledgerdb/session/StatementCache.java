package ledgerdb.session;

import ledgerdb.QueryException;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Per-session cache of prepared statements keyed by their exact query text.
 *
 * <p>An entry is prepared on the first {@link #checkout(String)} of its text and
 * reused for the lifetime of the session; entries are never evicted. A failed
 * prepare leaves no entry behind. When two threads prepare the same text at
 * once, the first to register wins and the other statement is closed.
 *
 * <p>Checkouts of the same text are exclusive: a second caller blocks until the
 * first {@link StatementHandle} is closed. Different texts can be checked out
 * concurrently.
 */
public final class StatementCache implements AutoCloseable {
  private final Session session;
  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private volatile boolean closed;

  StatementCache(Session session) {
    this.session = session;
  }

  /**
   * Returns an exclusive handle on the prepared statement for {@code sql},
   * blocking while another holder has it checked out.
   *
   * <p>Parameters bound by a previous holder may still be set; rebind before use.
   *
   * @param sql query text, matched exactly (no normalisation)
   * @return a handle to close once the statement is no longer used
   * @throws QueryException if the statement cannot be prepared
   * @throws IllegalStateException if the calling thread already holds this statement
   */
  public StatementHandle checkout(String sql) {
    Objects.requireNonNull(sql, "sql");
    if (closed) {
      throw new IllegalStateException("Statement cache of session " + session.name() + " has been closed");
    }
    Entry entry = entries.get(sql);
    if (entry == null) {
      entry = install(prepare(sql));
    }
    entry.acquire();
    return new StatementHandle(session, entry);
  }

  // Called with a statement prepared outside the map; a losing duplicate is closed.
  private Entry install(Entry prepared) {
    Entry existing = entries.putIfAbsent(prepared.sql, prepared);
    if (existing == null) {
      return prepared;
    }
    try {
      prepared.statement.close();
    } catch (SQLException e) {
      throw new QueryException("Failed to close duplicate statement: " + prepared.sql, e);
    }
    return existing;
  }

  /**
   * Number of cached statements.
   */
  public int size() {
    return entries.size();
  }

  public boolean contains(String sql) {
    return entries.containsKey(sql);
  }

  private Entry prepare(String sql) {
    try {
      return new Entry(sql, session.connection().prepareStatement(sql));
    } catch (SQLException e) {
      throw new QueryException("Failed to prepare statement: " + sql, e);
    }
  }

  /**
   * Closes every cached statement. Called when the owning session closes.
   *
   * @throws QueryException if any statement fails to close; remaining
   *     statements are still closed
   */
  @Override
  public void close() {
    closed = true;
    QueryException first = null;
    for (Entry entry : entries.values()) {
      try {
        entry.statement.close();
      } catch (SQLException e) {
        if (first == null) {
          first = new QueryException("Failed to close cached statements of session " + session.name(), e);
        } else {
          first.addSuppressed(e);
        }
      }
    }
    entries.clear();
    if (first != null) {
      throw first;
    }
  }

  static final class Entry {
    final String sql;
    final PreparedStatement statement;
    private final Semaphore permit = new Semaphore(1);
    private volatile Thread owner;

    private Entry(String sql, PreparedStatement statement) {
      this.sql = sql;
      this.statement = statement;
    }

    void acquire() {
      if (owner == Thread.currentThread()) {
        throw new IllegalStateException("Statement is already checked out by this thread: " + sql);
      }
      permit.acquireUninterruptibly();
      owner = Thread.currentThread();
    }

    void release() {
      owner = null;
      permit.release();
    }
  }
}
