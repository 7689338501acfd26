package ledgerdb.jdbc.backend;

import ledgerdb.spi.Backend;
import ledgerdb.spi.BackendKind;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Base backend applying the tuning rule shared by every built-in store.
 *
 * <p>Networked stores run each session, primary and pooled, at serializable
 * isolation. Embedded stores enable their durable journaling mode through
 * {@link #enableJournaling} on the primary session only; pool entries of an
 * embedded store are left as opened.
 */
public abstract class AbstractBackend implements Backend {

  @Override
  public void tune(Connection connection) throws SQLException {
    if (kind() == BackendKind.NETWORKED) {
      connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
    } else {
      enableJournaling(connection);
    }
  }

  @Override
  public void tunePoolEntry(Connection connection) throws SQLException {
    if (kind() == BackendKind.NETWORKED) {
      connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
    }
  }

  /**
   * Switches an embedded store to its write-ahead journaling mode. No-op by default.
   */
  protected void enableJournaling(Connection connection) throws SQLException {
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name() + "]";
  }
}
