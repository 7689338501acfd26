package ledgerdb.pool;

import ledgerdb.session.Session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ownership guard over one {@link ConnectionPool} slot. Closing it returns the
 * slot to the pool; subsequent calls are no-ops.
 */
public final class PooledSession implements AutoCloseable {
  private final ConnectionPool pool;
  private final int slot;
  private final Session session;
  private final AtomicBoolean released = new AtomicBoolean();

  PooledSession(ConnectionPool pool, int slot, Session session) {
    this.pool = pool;
    this.slot = slot;
    this.session = session;
  }

  /**
   * The borrowed session.
   *
   * @throws IllegalStateException if this guard has been closed
   */
  public Session session() {
    if (released.get()) {
      throw new IllegalStateException("Pooled session " + slot + " has been returned to the pool");
    }
    return session;
  }

  /**
   * Position of the borrowed slot in the pool.
   */
  public int slot() {
    return slot;
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      pool.release(slot);
    }
  }
}
