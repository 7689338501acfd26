package ledgerdb;

import ledgerdb.backend.Backends;
import ledgerdb.metrics.OperationCategory;
import ledgerdb.metrics.OperationTimer;
import ledgerdb.pool.ConnectionPool;
import ledgerdb.session.Session;
import ledgerdb.session.SqlCapture;
import ledgerdb.session.StatementHandle;
import ledgerdb.spi.Backend;
import ledgerdb.spi.BackendKind;
import ledgerdb.spi.MetricsRecorder;
import ledgerdb.spi.SchemaOwner;
import ledgerdb.spi.TimerKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner of every access path to the backing store: the primary session, its
 * prepared-statement cache, the lazily built connection pool, SQL capture and
 * operation timers.
 *
 * <p>Building a {@code Database} registers the backend drivers (once per
 * process), resolves the backend from the URL, and opens and tunes the primary
 * session:
 * <ul>
 *   <li><b>Embedded</b> backends switch the store to write-ahead-log journaling.
 *   <li><b>Networked</b> backends run every session at serializable isolation.
 * </ul>
 *
 * <p>The primary session is meant for one controlling thread. Callers that work
 * from several threads must either synchronise externally or take sessions from
 * {@link #getPool()}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see Database.Builder
 */
public final class Database implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Database.class.getName());

  static final String METRIC_NAMESPACE = "database";
  private static final int HARDWARE_CONCURRENCY = Runtime.getRuntime().availableProcessors();

  private final String url;
  private final Backend backend;
  private final MetricsRecorder metrics;
  private final List<SchemaOwner> schemaOwners;
  private final int poolSize;
  private final Duration poolAcquireTimeout;
  private final Session session;

  private ConnectionPool pool;
  private boolean closed;

  private Database(Builder builder) {
    this.url = Objects.requireNonNull(builder.url, "url");
    if (builder.poolSize < 0) {
      throw new IllegalArgumentException("poolSize must be >= 0");
    }
    if (builder.poolAcquireTimeout != null
        && (builder.poolAcquireTimeout.isNegative() || builder.poolAcquireTimeout.isZero())) {
      throw new IllegalArgumentException("poolAcquireTimeout must be > 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsRecorder.NOOP;
    this.schemaOwners = List.copyOf(builder.schemaOwners);
    this.poolSize = builder.poolSize > 0 ? builder.poolSize : HARDWARE_CONCURRENCY;
    this.poolAcquireTimeout = builder.poolAcquireTimeout;

    registerDrivers();
    this.backend = resolveBackend(url);
    if (!Backends.isAvailable(backend)) {
      throw new ConnectionException("No JDBC driver for backend " + backend.name()
          + " (" + backend.driverClassName() + ") on the classpath");
    }
    logger.log(Level.INFO, "Connecting to: {0}", url);
    this.session = Session.open(backend, url, "primary");
  }

  private static Backend resolveBackend(String url) {
    try {
      return Backends.detect(url);
    } catch (ConfigurationException e) {
      throw new ConnectionException("Cannot open " + url + ": " + e.getMessage(), e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers every backend driver. Idempotent; called by every build.
   *
   * @see Backends#ensureDriversRegistered()
   */
  public static void registerDrivers() {
    Backends.ensureDriversRegistered();
  }

  public String url() {
    return url;
  }

  public Backend backend() {
    return backend;
  }

  /**
   * The primary session.
   */
  public Session getSession() {
    return session;
  }

  public boolean isEmbedded() {
    return backend.kind() == BackendKind.EMBEDDED;
  }

  /**
   * Whether {@link #getPool()} can build a pool for the configured URL. False
   * for private in-memory stores that a second connection could not see.
   */
  public boolean canUsePool() {
    return backend.supportsPooling(url);
  }

  /**
   * Starts a timer recording under {@code (database, category, entityName)}.
   */
  public OperationTimer startTimer(OperationCategory category, String entityName) {
    return new OperationTimer(metrics, new TimerKey(METRIC_NAMESPACE, category, entityName));
  }

  public OperationTimer getInsertTimer(String entityName) {
    return startTimer(OperationCategory.INSERT, entityName);
  }

  public OperationTimer getSelectTimer(String entityName) {
    return startTimer(OperationCategory.SELECT, entityName);
  }

  public OperationTimer getDeleteTimer(String entityName) {
    return startTimer(OperationCategory.DELETE, entityName);
  }

  public OperationTimer getUpdateTimer(String entityName) {
    return startTimer(OperationCategory.UPDATE, entityName);
  }

  /**
   * Checks out the primary session's cached prepared statement for {@code sql}.
   *
   * @throws QueryException if the statement cannot be prepared
   */
  public StatementHandle getPreparedStatement(String sql) {
    return session.prepare(sql);
  }

  /**
   * Captures the statements executed on the primary session until the returned
   * capture is closed, then logs them under {@code contextName}.
   *
   * @throws IllegalStateException if a capture is already active on the primary session
   */
  public SqlCapture captureAndLogSql(String contextName) {
    return session.captureSql(contextName);
  }

  /**
   * Drops and recreates every registered schema, in registration order.
   *
   * @throws QueryException naming the stage that failed; later stages are not run
   */
  public void initialize() {
    for (SchemaOwner owner : schemaOwners) {
      logger.log(Level.FINE, "Resetting schema {0}", owner.name());
      try {
        owner.dropAll(this);
      } catch (RuntimeException e) {
        throw new QueryException("Failed to reset schema at stage '" + owner.name() + "'", e);
      }
    }
  }

  /**
   * Returns the connection pool, building it on first call.
   *
   * @throws ConfigurationException if the configured URL cannot be pooled; no
   *     pool is built and the next call fails the same way
   * @throws ConnectionException if a pool session cannot be opened; no pool is built
   */
  public synchronized ConnectionPool getPool() {
    if (closed) {
      throw new IllegalStateException("Database has been closed");
    }
    if (pool == null) {
      if (!canUsePool()) {
        throw new ConfigurationException("Can't create connection pool to " + url);
      }
      logger.log(Level.INFO, "Establishing {0}-entry connection pool to: {1}",
          new Object[]{poolSize, url});
      pool = ConnectionPool.open(backend, url, poolSize, poolAcquireTimeout);
    }
    return pool;
  }

  /**
   * Whether {@link #getPool()} has built the pool.
   */
  public synchronized boolean isPoolCreated() {
    return pool != null;
  }

  /**
   * Closes the pool, if built, then the primary session.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    if (pool != null) {
      try {
        pool.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      session.close();
    } catch (RuntimeException e) {
      if (first == null) first = e;
      else first.addSuppressed(e);
    }
    if (first != null) throw first;
  }

  /** Builder for {@link Database}. */
  public static final class Builder {
    private String url;
    private MetricsRecorder metrics;
    private final List<SchemaOwner> schemaOwners = new ArrayList<>();
    private int poolSize;
    private Duration poolAcquireTimeout;

    private Builder() {}

    /**
     * Sets the JDBC URL of the backing store. The backend is chosen from its prefix.
     *
     * <p><b>Required.</b>
     *
     * @param url the JDBC URL
     * @return this builder
     */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /**
     * Sets the recorder receiving operation timer samples.
     *
     * <p>Optional. Defaults to {@link MetricsRecorder#NOOP}.
     *
     * @param metrics the metrics recorder
     * @return this builder
     */
    public Builder metrics(MetricsRecorder metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds a schema owner reset by {@link Database#initialize()}. Owners run in
     * the order they are added.
     *
     * @param schemaOwner the schema owner
     * @return this builder
     */
    public Builder schemaOwner(SchemaOwner schemaOwner) {
      this.schemaOwners.add(Objects.requireNonNull(schemaOwner, "schemaOwner"));
      return this;
    }

    /**
     * Sets the number of sessions in the connection pool.
     *
     * <p>Optional. Defaults to {@code 0}, meaning the number of available processors.
     * Must be &ge; 0.
     *
     * @param poolSize pool size
     * @return this builder
     */
    public Builder poolSize(int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    /**
     * Bounds how long {@link ConnectionPool#acquire()} waits for a free session.
     *
     * <p>Optional. Defaults to {@code null}: acquires wait without limit.
     *
     * @param poolAcquireTimeout maximum wait, &gt; 0
     * @return this builder
     */
    public Builder poolAcquireTimeout(Duration poolAcquireTimeout) {
      this.poolAcquireTimeout = poolAcquireTimeout;
      return this;
    }

    /**
     * Registers drivers and opens the primary session.
     *
     * @return a new {@link Database}
     * @throws NullPointerException if {@code url} is null
     * @throws IllegalArgumentException if {@code poolSize} is negative or
     *     {@code poolAcquireTimeout} is not positive
     * @throws InitializationException if driver registration fails
     * @throws ConnectionException if the URL is empty, no backend handles it, or
     *     the primary session cannot be opened
     */
    public Database build() {
      return new Database(this);
    }
  }
}
