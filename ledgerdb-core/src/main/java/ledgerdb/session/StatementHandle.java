package ledgerdb.session;

import ledgerdb.QueryException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exclusive checkout of a cached prepared statement.
 *
 * <p>Use via try-with-resources; {@link #close()} hands the statement back to
 * the {@link StatementCache} without closing it:
 * <pre>{@code
 * try (StatementHandle st = session.prepare("SELECT balance FROM accounts WHERE id=?")) {
 *     Optional<Long> balance = st.bind(accountId).queryOne(rs -> rs.getLong("balance"));
 * }
 * }</pre>
 *
 * <p>JDBC failures, including a {@link RowMapper} reading a column the query does
 * not return, surface as {@link QueryException}.
 */
public final class StatementHandle implements AutoCloseable {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final Session session;
  private final StatementCache.Entry entry;
  private boolean released;

  StatementHandle(Session session, StatementCache.Entry entry) {
    this.session = session;
    this.entry = entry;
  }

  public String sql() {
    return entry.sql;
  }

  /**
   * The shared prepared statement. Valid only until this handle is closed.
   */
  public PreparedStatement statement() {
    ensureOpen();
    return entry.statement;
  }

  /**
   * Clears any previously bound parameters and binds {@code params} in order.
   */
  public StatementHandle bind(Object... params) {
    PreparedStatement ps = statement();
    try {
      ps.clearParameters();
      for (int i = 0; i < params.length; i++) {
        Object param = params[i];
        if (param == null) {
          ps.setObject(i + 1, null);
        } else if (param instanceof String s) {
          ps.setString(i + 1, s);
        } else if (param instanceof Integer n) {
          ps.setInt(i + 1, n);
        } else if (param instanceof Long n) {
          ps.setLong(i + 1, n);
        } else if (param instanceof Timestamp ts) {
          ps.setTimestamp(i + 1, ts);
        } else {
          ps.setObject(i + 1, param);
        }
      }
    } catch (SQLException e) {
      throw new QueryException("Failed to bind parameters for: " + entry.sql, e);
    }
    return this;
  }

  /** Execute the statement as an update, return rows affected. */
  public int executeUpdate() {
    PreparedStatement ps = statement();
    session.trace(entry.sql);
    try {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new QueryException("Failed to execute update: " + entry.sql, e);
    }
  }

  /** Execute the statement, return whether it produced a result set. */
  public boolean execute() {
    PreparedStatement ps = statement();
    session.trace(entry.sql);
    try {
      return ps.execute();
    } catch (SQLException e) {
      throw new QueryException("Failed to execute: " + entry.sql, e);
    }
  }

  /** Execute the statement as a query, map every row. */
  public <T> List<T> query(RowMapper<T> mapper) {
    PreparedStatement ps = statement();
    session.trace(entry.sql);
    try (ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    } catch (SQLException e) {
      throw new QueryException("Failed to execute query: " + entry.sql, e);
    }
  }

  /** Execute the statement as a query, map the first row if there is one. */
  public <T> Optional<T> queryOne(RowMapper<T> mapper) {
    PreparedStatement ps = statement();
    session.trace(entry.sql);
    try (ResultSet rs = ps.executeQuery()) {
      return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
    } catch (SQLException e) {
      throw new QueryException("Failed to execute query: " + entry.sql, e);
    }
  }

  private void ensureOpen() {
    if (released) {
      throw new IllegalStateException("Statement handle has been released: " + entry.sql);
    }
  }

  /**
   * Releases the statement back to the cache. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (released) {
      return;
    }
    released = true;
    entry.release();
  }
}
