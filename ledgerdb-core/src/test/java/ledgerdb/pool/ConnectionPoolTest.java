package ledgerdb.pool;

import ledgerdb.ConnectionException;
import ledgerdb.backend.Backends;
import ledgerdb.backend.EmbeddedTestBackend;
import ledgerdb.spi.Backend;
import ledgerdb.spi.BackendKind;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

  private static String url() {
    return EmbeddedTestBackend.SCHEME + "pool_" + UUID.randomUUID().toString().replace("-", "");
  }

  private static ConnectionPool open(int size) {
    String url = url();
    return ConnectionPool.open(Backends.detect(url), url, size, null);
  }

  @Test
  void rejectsInvalidArguments() {
    String url = url();
    Backend backend = Backends.detect(url);
    assertThrows(IllegalArgumentException.class, () -> ConnectionPool.open(backend, url, 0, null));
    assertThrows(IllegalArgumentException.class,
        () -> ConnectionPool.open(backend, url, 1, Duration.ZERO));
    assertThrows(NullPointerException.class, () -> ConnectionPool.open(null, url, 1, null));
  }

  @Test
  void acquireAndReleaseTrackAvailability() throws Exception {
    try (ConnectionPool pool = open(2)) {
      assertEquals(2, pool.size());
      assertEquals(2, pool.available());

      PooledSession first = pool.acquire();
      PooledSession second = pool.acquire();
      assertEquals(0, pool.available());
      assertNotEquals(first.slot(), second.slot());
      assertNotSame(first.session(), second.session());

      first.close();
      first.close();
      assertEquals(1, pool.available());
      assertThrows(IllegalStateException.class, first::session);

      second.close();
      assertEquals(2, pool.available());
    }
  }

  @Test
  void acquireTimesOutWhenExhausted() throws Exception {
    try (ConnectionPool pool = open(1);
         PooledSession ignored = pool.acquire()) {
      IllegalStateException ex = assertThrows(IllegalStateException.class,
          () -> pool.acquire(Duration.ofMillis(50)));
      assertTrue(ex.getMessage().contains("Timed out after 50ms"));
    }
  }

  @Test
  void concurrentHoldersNeverShareASlot() throws Exception {
    int threads = 8;
    int rounds = 50;
    Set<Integer> inUse = ConcurrentHashMap.newKeySet();
    AtomicBoolean shared = new AtomicBoolean();
    List<Throwable> failures = new CopyOnWriteArrayList<>();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);

    try (ConnectionPool pool = open(3)) {
      for (int t = 0; t < threads; t++) {
        executor.submit(() -> {
          try {
            start.await();
            for (int i = 0; i < rounds; i++) {
              try (PooledSession pooled = pool.acquire()) {
                if (!inUse.add(pooled.slot())) {
                  shared.set(true);
                }
                pooled.session().execute("SELECT 1");
                inUse.remove(pooled.slot());
              }
            }
          } catch (Throwable e) {
            failures.add(e);
          }
        });
      }
      start.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

      assertTrue(failures.isEmpty(), () -> "failures: " + failures);
      assertFalse(shared.get());
      assertEquals(3, pool.available());
    }
  }

  @Test
  void closedPoolRejectsAcquire() throws Exception {
    ConnectionPool pool = open(1);
    PooledSession held = pool.acquire();

    pool.close();
    pool.close();

    assertTrue(held.session().isClosed());
    assertThrows(IllegalStateException.class, pool::acquire);
    assertThrows(IllegalStateException.class, () -> pool.acquire(Duration.ofMillis(10)));
  }

  @Test
  void partialOpenFailureClosesOpenedSessions() {
    FailingBackend backend = new FailingBackend(2);

    ConnectionException ex = assertThrows(ConnectionException.class,
        () -> ConnectionPool.open(backend, "failing:" + UUID.randomUUID(), 4, null));

    assertTrue(ex.getMessage().contains("pool-2"));
    assertEquals(2, backend.opened.size());
    for (Connection connection : backend.opened) {
      assertTrue(isClosed(connection));
    }
  }

  private static boolean isClosed(Connection connection) {
    try {
      return connection.isClosed();
    } catch (SQLException e) {
      throw new AssertionError(e);
    }
  }

  /**
   * Opens private H2 databases until {@code succeedFor} connections exist, then fails.
   */
  private static final class FailingBackend implements Backend {
    private final int succeedFor;
    private final List<Connection> opened = new CopyOnWriteArrayList<>();

    FailingBackend(int succeedFor) {
      this.succeedFor = succeedFor;
    }

    @Override
    public String name() {
      return "failing";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of("failing:");
    }

    @Override
    public BackendKind kind() {
      return BackendKind.NETWORKED;
    }

    @Override
    public String driverClassName() {
      return "org.h2.Driver";
    }

    @Override
    public Connection open(String jdbcUrl) throws SQLException {
      if (opened.size() >= succeedFor) {
        throw new SQLException("Connection refused");
      }
      Connection connection = DriverManager.getConnection("jdbc:h2:mem:");
      opened.add(connection);
      return connection;
    }

    @Override
    public void tune(Connection connection) {
    }
  }
}
