package ledgerdb.pool;

import ledgerdb.ConnectionException;
import ledgerdb.spi.Backend;
import ledgerdb.session.Session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool of independently tuned {@link Session}s against one URL.
 *
 * <p>Sessions are handed out only through {@link PooledSession} guards: a slot is
 * taken from a queue of free slots on {@link #acquire()} and put back exactly once
 * when the guard closes, so no two holders ever share a session.
 * <pre>{@code
 * try (PooledSession pooled = pool.acquire()) {
 *     pooled.session().execute("...");
 * }
 * }</pre>
 *
 * <p>Acquires block without limit unless a default timeout was configured or
 * {@link #acquire(Duration)} is used. The pool never reopens a failed session;
 * the error reaches whoever is using it.
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private final List<Session> sessions;
  private final BlockingQueue<Integer> freeSlots;
  private final Duration defaultAcquireTimeout;
  private volatile boolean closed;

  private ConnectionPool(List<Session> sessions, Duration defaultAcquireTimeout) {
    this.sessions = List.copyOf(sessions);
    this.freeSlots = new ArrayBlockingQueue<>(sessions.size());
    for (int i = 0; i < sessions.size(); i++) {
      freeSlots.add(i);
    }
    this.defaultAcquireTimeout = defaultAcquireTimeout;
  }

  /**
   * Opens {@code size} sessions through {@code backend}, each with the
   * backend's pool entry tuning. If any session fails to open, the ones already
   * opened are closed and no pool is returned.
   *
   * @param backend               backend resolved for {@code jdbcUrl}
   * @param jdbcUrl               the JDBC URL
   * @param size                  number of sessions, &gt; 0
   * @param defaultAcquireTimeout bound applied by {@link #acquire()}, or {@code null} to block without limit
   * @throws ConnectionException if a session cannot be opened
   */
  public static ConnectionPool open(Backend backend, String jdbcUrl, int size, Duration defaultAcquireTimeout) {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (size <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    if (defaultAcquireTimeout != null && (defaultAcquireTimeout.isNegative() || defaultAcquireTimeout.isZero())) {
      throw new IllegalArgumentException("defaultAcquireTimeout must be > 0");
    }

    List<Session> opened = new ArrayList<>(size);
    try {
      for (int i = 0; i < size; i++) {
        logger.log(Level.FINE, "Opening pool entry {0}", i);
        opened.add(Session.openPoolEntry(backend, jdbcUrl, "pool-" + i));
      }
    } catch (ConnectionException e) {
      for (Session session : opened) {
        try {
          session.close();
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      throw e;
    }
    return new ConnectionPool(opened, defaultAcquireTimeout);
  }

  /**
   * Number of sessions in the pool. Fixed for the pool's lifetime.
   */
  public int size() {
    return sessions.size();
  }

  /**
   * Number of sessions not currently checked out.
   */
  public int available() {
    return freeSlots.size();
  }

  /**
   * Checks out a free session, waiting for one if all are in use. Waits without
   * limit unless the pool was opened with a default acquire timeout.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the pool is closed or the default timeout expires
   */
  public PooledSession acquire() throws InterruptedException {
    if (defaultAcquireTimeout != null) {
      return acquire(defaultAcquireTimeout);
    }
    ensureOpen();
    return checkout(freeSlots.take());
  }

  /**
   * Checks out a free session, waiting at most {@code timeout}.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the pool is closed or no session frees up in time
   */
  public PooledSession acquire(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    ensureOpen();
    Integer slot = freeSlots.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (slot == null) {
      throw new IllegalStateException("Timed out after " + timeout.toMillis()
          + "ms waiting for a pooled session (size " + size() + ")");
    }
    return checkout(slot);
  }

  private PooledSession checkout(int slot) {
    if (closed) {
      freeSlots.offer(slot);
      throw new IllegalStateException("ConnectionPool has been closed");
    }
    return new PooledSession(this, slot, sessions.get(slot));
  }

  void release(int slot) {
    freeSlots.offer(slot);
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("ConnectionPool has been closed");
    }
  }

  /**
   * Closes every session in the pool, including checked-out ones.
   *
   * @throws ConnectionException if any session fails to close; the rest are still closed
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    for (Session session : sessions) {
      try {
        session.close();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
