package ledgerdb;

import ledgerdb.backend.Backends;
import ledgerdb.backend.EmbeddedTestBackend;
import ledgerdb.backend.H2TestBackend;
import ledgerdb.backend.NetworkedTestBackend;
import ledgerdb.metrics.OperationCategory;
import ledgerdb.metrics.OperationTimer;
import ledgerdb.metrics.RecordingMetricsRecorder;
import ledgerdb.pool.ConnectionPool;
import ledgerdb.pool.PooledSession;
import ledgerdb.session.StatementHandle;
import ledgerdb.spi.SchemaOwner;
import ledgerdb.spi.TimerKey;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

  private final List<Database> opened = new ArrayList<>();

  @AfterEach
  void closeDatabases() {
    for (Database database : opened) {
      database.close();
    }
  }

  private Database open(Database.Builder builder) {
    Database database = builder.build();
    opened.add(database);
    return database;
  }

  private static String embeddedUrl() {
    return EmbeddedTestBackend.SCHEME + "db_" + UUID.randomUUID().toString().replace("-", "");
  }

  private static String networkedUrl() {
    return NetworkedTestBackend.SCHEME + "db_" + UUID.randomUUID().toString().replace("-", "");
  }

  @Test
  void builderRequiresUrl() {
    NullPointerException ex = assertThrows(NullPointerException.class,
        () -> Database.builder().build());
    assertEquals("url", ex.getMessage());
  }

  @Test
  void builderRejectsNegativePoolSize() {
    assertThrows(IllegalArgumentException.class,
        () -> Database.builder().url(embeddedUrl()).poolSize(-1).build());
  }

  @Test
  void builderRejectsNonPositiveAcquireTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> Database.builder().url(embeddedUrl()).poolAcquireTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> Database.builder().url(embeddedUrl()).poolAcquireTimeout(Duration.ofSeconds(-1)).build());
  }

  @Test
  void unknownUrlFailsToConnect() {
    ConnectionException ex = assertThrows(ConnectionException.class,
        () -> Database.builder().url("no-such-scheme:whatever").build());
    assertTrue(ex.getMessage().contains("No backend found"));
    assertInstanceOf(ConfigurationException.class, ex.getCause());
  }

  @Test
  void emptyUrlFailsToConnect() {
    ConnectionException ex = assertThrows(ConnectionException.class,
        () -> Database.builder().url("").build());
    assertTrue(ex.getMessage().contains("cannot be null or empty"));
  }

  @Test
  void buildRegistersDriversOnce() {
    open(Database.builder().url(embeddedUrl()));
    open(Database.builder().url(networkedUrl()));
    open(Database.builder().url(embeddedUrl()));

    assertEquals(1, ((H2TestBackend) Backends.get("test-embedded")).driverLoads());
    assertEquals(1, ((H2TestBackend) Backends.get("test-networked")).driverLoads());
  }

  @Test
  void embeddedPrimarySessionIsTunedButNotSerializable() throws SQLException {
    H2TestBackend backend = (H2TestBackend) Backends.get("test-embedded");
    int before = backend.tuneCount();

    Database database = open(Database.builder().url(embeddedUrl()));

    assertTrue(database.isEmbedded());
    assertSame(backend, database.backend());
    assertEquals(before + 1, backend.tuneCount());
    assertNotEquals(Connection.TRANSACTION_SERIALIZABLE,
        database.getSession().connection().getTransactionIsolation());
  }

  @Test
  void embeddedPoolEntriesSkipPrimaryTuning() {
    H2TestBackend backend = (H2TestBackend) Backends.get("test-embedded");
    int tunes = backend.tuneCount();
    int poolTunes = backend.poolEntryTuneCount();

    Database database = open(Database.builder().url(embeddedUrl()).poolSize(2));
    database.getPool();

    assertEquals(tunes + 1, backend.tuneCount());
    assertEquals(poolTunes + 2, backend.poolEntryTuneCount());
  }

  @Test
  void networkedPrimaryAndPoolSessionsAreSerializable() throws Exception {
    Database database = open(Database.builder().url(networkedUrl()).poolSize(3));

    assertFalse(database.isEmbedded());
    assertTrue(database.canUsePool());
    assertEquals(Connection.TRANSACTION_SERIALIZABLE,
        database.getSession().connection().getTransactionIsolation());

    ConnectionPool pool = database.getPool();
    List<PooledSession> held = new ArrayList<>();
    for (int i = 0; i < pool.size(); i++) {
      held.add(pool.acquire());
    }
    for (PooledSession pooled : held) {
      assertEquals(Connection.TRANSACTION_SERIALIZABLE,
          pooled.session().connection().getTransactionIsolation());
      pooled.close();
    }
  }

  @Test
  void privateMemoryStoreCannotBePooled() {
    Database database = open(Database.builder().url(EmbeddedTestBackend.SCHEME + ":memory:"));

    assertTrue(database.isEmbedded());
    assertFalse(database.canUsePool());

    ConfigurationException first = assertThrows(ConfigurationException.class, database::getPool);
    assertEquals("Can't create connection pool to " + EmbeddedTestBackend.SCHEME + ":memory:",
        first.getMessage());
    assertFalse(database.isPoolCreated());

    ConfigurationException second = assertThrows(ConfigurationException.class, database::getPool);
    assertEquals(first.getMessage(), second.getMessage());
    assertFalse(database.isPoolCreated());
  }

  @Test
  void poolDefaultsToHardwareParallelismAndIsBuiltOnce() {
    Database database = open(Database.builder().url(embeddedUrl()));
    assertFalse(database.isPoolCreated());

    ConnectionPool pool = database.getPool();

    assertTrue(database.isPoolCreated());
    assertEquals(Runtime.getRuntime().availableProcessors(), pool.size());
    assertSame(pool, database.getPool());
    assertEquals(pool.size(), database.getPool().size());
  }

  @Test
  void poolSizeOverride() {
    Database database = open(Database.builder().url(embeddedUrl()).poolSize(2));

    assertEquals(2, database.getPool().size());
    assertEquals(2, database.getPool().available());
  }

  @Test
  void poolAcquireTimeoutBoundsDefaultAcquire() throws Exception {
    Database database = open(Database.builder()
        .url(embeddedUrl())
        .poolSize(1)
        .poolAcquireTimeout(Duration.ofMillis(50)));
    ConnectionPool pool = database.getPool();

    try (PooledSession ignored = pool.acquire()) {
      IllegalStateException ex = assertThrows(IllegalStateException.class, pool::acquire);
      assertTrue(ex.getMessage().contains("Timed out"));
    }
    assertEquals(1, pool.available());
  }

  @Test
  void pooledSessionsSeeThePrimaryStore() throws Exception {
    Database database = open(Database.builder().url(embeddedUrl()).poolSize(2));
    database.getSession().execute("CREATE TABLE accounts (id BIGINT PRIMARY KEY, balance BIGINT)");
    database.getSession().execute("INSERT INTO accounts VALUES (1, 100)");

    try (PooledSession pooled = database.getPool().acquire();
         StatementHandle st = pooled.session().prepare("SELECT balance FROM accounts WHERE id = ?")) {
      Optional<Long> balance = st.bind(1L).queryOne(rs -> rs.getLong("balance"));
      assertEquals(Optional.of(100L), balance);
    }
  }

  @Test
  void preparedStatementIsCachedByExactText() {
    Database database = open(Database.builder().url(embeddedUrl()));
    String sql = "SELECT 1";

    PreparedStatement first;
    try (StatementHandle st = database.getPreparedStatement(sql)) {
      first = st.statement();
    }
    try (StatementHandle st = database.getPreparedStatement(sql)) {
      assertSame(first, st.statement());
    }
    try (StatementHandle st = database.getPreparedStatement("SELECT  1")) {
      assertNotSame(first, st.statement());
    }
    assertEquals(2, database.getSession().statements().size());
  }

  @Test
  void preparedStatementFailureThrowsQueryException() {
    Database database = open(Database.builder().url(embeddedUrl()));

    assertThrows(QueryException.class, () -> database.getPreparedStatement("SELECT * FROM missing_table"));
    assertEquals(0, database.getSession().statements().size());
  }

  @Test
  void timersRecordUnderDatabaseNamespace() {
    RecordingMetricsRecorder recorder = new RecordingMetricsRecorder();
    Database database = open(Database.builder().url(embeddedUrl()).metrics(recorder));

    try (OperationTimer ignored = database.getInsertTimer("account")) {
      database.getSession().execute("SELECT 1");
    }
    database.getSelectTimer("offer").close();
    database.getDeleteTimer("trustline").close();
    database.getUpdateTimer("ledgerheader").close();

    assertEquals(List.of(
        new TimerKey("database", OperationCategory.INSERT, "account"),
        new TimerKey("database", OperationCategory.SELECT, "offer"),
        new TimerKey("database", OperationCategory.DELETE, "trustline"),
        new TimerKey("database", OperationCategory.UPDATE, "ledgerheader")), recorder.keys());
  }

  @Test
  void initializeRunsSchemaOwnersInOrder() {
    List<String> calls = new ArrayList<>();
    Database database = open(Database.builder()
        .url(embeddedUrl())
        .schemaOwner(owner("accounts", calls))
        .schemaOwner(owner("offers", calls))
        .schemaOwner(owner("trustlines", calls)));

    database.initialize();

    assertEquals(List.of("accounts", "offers", "trustlines"), calls);
  }

  @Test
  void initializeStopsAtFailingStage() {
    List<String> calls = new ArrayList<>();
    SchemaOwner failing = new SchemaOwner() {
      @Override
      public String name() {
        return "offers";
      }

      @Override
      public void dropAll(Database database) {
        calls.add("offers");
        database.getSession().execute("DROP TABLE offers");
      }
    };
    Database database = open(Database.builder()
        .url(embeddedUrl())
        .schemaOwner(owner("accounts", calls))
        .schemaOwner(failing)
        .schemaOwner(owner("trustlines", calls)));

    QueryException ex = assertThrows(QueryException.class, database::initialize);

    assertEquals("Failed to reset schema at stage 'offers'", ex.getMessage());
    assertInstanceOf(QueryException.class, ex.getCause());
    assertEquals(List.of("accounts", "offers"), calls);
  }

  @Test
  void schemaOwnerCanRecreateTables() {
    SchemaOwner accounts = new SchemaOwner() {
      @Override
      public String name() {
        return "accounts";
      }

      @Override
      public void dropAll(Database database) {
        database.getSession().execute("DROP TABLE IF EXISTS accounts");
        database.getSession().execute("CREATE TABLE accounts (id BIGINT PRIMARY KEY)");
      }
    };
    Database database = open(Database.builder().url(embeddedUrl()).schemaOwner(accounts));
    database.initialize();
    database.getSession().execute("INSERT INTO accounts VALUES (1)");

    database.initialize();

    try (StatementHandle st = database.getPreparedStatement("SELECT COUNT(*) FROM accounts")) {
      assertEquals(Optional.of(0L), st.queryOne(rs -> rs.getLong(1)));
    }
  }

  @Test
  void closeClosesPoolAndPrimarySession() {
    Database database = Database.builder().url(embeddedUrl()).poolSize(1).build();
    ConnectionPool pool = database.getPool();

    database.close();
    database.close();

    assertTrue(database.getSession().isClosed());
    assertThrows(IllegalStateException.class, pool::acquire);
    assertThrows(IllegalStateException.class, database::getPool);
  }

  private static SchemaOwner owner(String name, List<String> calls) {
    return new SchemaOwner() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public void dropAll(Database database) {
        calls.add(name);
      }
    };
  }
}
