package ledgerdb.session;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Scoped capture of the statements a {@link Session} executes.
 *
 * <p>Created by {@link Session#captureSql(String)}. On {@link #close()} the
 * capture detaches from the session and logs what it saw as one block:
 * <pre>
 *
 *
 * [SQL] -----------------------
 * [SQL] begin capture: name
 * [SQL] -----------------------
 * [SQL:name] SELECT ...
 * [SQL] -----------------------
 * [SQL] end capture: name
 * [SQL] -----------------------
 *
 *
 * </pre>
 * The frame is logged even when nothing was captured.
 */
public final class SqlCapture implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SqlCapture.class.getName());

  static final String SEPARATOR = "[SQL] -----------------------";

  private final String name;
  private final Session session;
  private final StringBuilder buffer = new StringBuilder();
  private final AtomicBoolean closed = new AtomicBoolean();

  SqlCapture(String name, Session session) {
    this.name = name;
    this.session = session;
  }

  public String name() {
    return name;
  }

  /**
   * Lines captured so far, in execution order.
   */
  public List<String> lines() {
    synchronized (buffer) {
      return buffer.toString().lines().toList();
    }
  }

  void append(String sql) {
    synchronized (buffer) {
      buffer.append(sql).append('\n');
    }
  }

  /**
   * Detaches from the session and logs the captured block. Runs once; later
   * calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    session.detach(this);

    logger.info("");
    logger.info("");
    logger.info(SEPARATOR);
    logger.info("[SQL] begin capture: " + name);
    logger.info(SEPARATOR);
    for (String line : lines()) {
      logger.info("[SQL:" + name + "] " + line);
    }
    logger.info(SEPARATOR);
    logger.info("[SQL] end capture: " + name);
    logger.info(SEPARATOR);
    logger.info("");
    logger.info("");
  }
}
