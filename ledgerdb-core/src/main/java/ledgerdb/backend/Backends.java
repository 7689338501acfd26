package ledgerdb.backend;

import ledgerdb.ConfigurationException;
import ledgerdb.InitializationException;
import ledgerdb.spi.Backend;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide registry of backends with URL-based detection.
 *
 * <p>Backends are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/ledgerdb.spi.Backend}. Loading and driver linkage
 * happen once per process, on the first call to any method of this class.
 * A backend whose JDBC driver is missing stays registered but unavailable.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Backends.ensureDriversRegistered();
 *
 * // Auto-detect from JDBC URL
 * Backend backend = Backends.detect("jdbc:sqlite:ledger.db");
 *
 * // Get by name
 * Backend backend = Backends.get("postgresql");
 * }</pre>
 */
public final class Backends {
  private static final Logger logger = Logger.getLogger(Backends.class.getName());

  private static final Object LOCK = new Object();
  private static volatile Registry registry;

  private Backends() {
  }

  /**
   * Loads every backend and links its driver. Idempotent and thread-safe: only
   * the first call does any work, concurrent first callers wait for it.
   *
   * @throws InitializationException if the provider configuration is broken or
   *     no backend is registered
   */
  public static void ensureDriversRegistered() {
    registry();
  }

  /**
   * Returns all registered backends, in discovery order.
   */
  public static List<Backend> all() {
    return registry().backends;
  }

  /**
   * Gets a backend by name.
   *
   * @param name backend name (case-insensitive)
   * @return the backend
   * @throws IllegalArgumentException if no backend has that name
   */
  public static Backend get(String name) {
    Backend backend = registry().byName.get(name.toLowerCase());
    if (backend == null) {
      throw new IllegalArgumentException("Unknown backend: " + name +
          ". Available: " + registry().byName.keySet());
    }
    return backend;
  }

  /**
   * Auto-detects the backend for a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the first backend with a matching prefix
   * @throws ConfigurationException if the URL is blank or no backend matches
   */
  public static Backend detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new ConfigurationException("JDBC URL cannot be null or empty");
    }
    for (Backend backend : all()) {
      for (String prefix : backend.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return backend;
        }
      }
    }
    throw new ConfigurationException("No backend found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Whether the driver of {@code backend} was linked during registration.
   */
  public static boolean isAvailable(Backend backend) {
    return registry().available.contains(backend.name().toLowerCase());
  }

  private static List<String> allPrefixes() {
    return all().stream()
        .flatMap(b -> b.jdbcUrlPrefixes().stream())
        .toList();
  }

  private static Registry registry() {
    Registry current = registry;
    if (current == null) {
      synchronized (LOCK) {
        current = registry;
        if (current == null) {
          current = load();
          registry = current;
        }
      }
    }
    return current;
  }

  private static Registry load() {
    List<Backend> backends;
    try {
      backends = ServiceLoader.load(Backend.class, Backends.class.getClassLoader())
          .stream()
          .map(ServiceLoader.Provider::get)
          .toList();
    } catch (ServiceConfigurationError e) {
      throw new InitializationException("Failed to load backend providers", e);
    }
    if (backends.isEmpty()) {
      throw new InitializationException("No backend registered under META-INF/services/"
          + Backend.class.getName());
    }

    Map<String, Backend> byName = new LinkedHashMap<>();
    Set<String> available = new HashSet<>();
    for (Backend backend : backends) {
      String key = backend.name().toLowerCase();
      byName.putIfAbsent(key, backend);
      try {
        backend.loadDriver();
        available.add(key);
        logger.log(Level.FINE, "Registered backend {0} ({1})",
            new Object[]{backend.name(), backend.driverClassName()});
      } catch (ClassNotFoundException | LinkageError e) {
        logger.log(Level.FINE, "Driver " + backend.driverClassName() + " for backend "
            + backend.name() + " is not on the classpath", e);
      }
    }
    return new Registry(backends, Map.copyOf(byName), Set.copyOf(available));
  }

  private static final class Registry {
    private final List<Backend> backends;
    private final Map<String, Backend> byName;
    private final Set<String> available;

    private Registry(List<Backend> backends, Map<String, Backend> byName, Set<String> available) {
      this.backends = backends;
      this.byName = byName;
      this.available = available;
    }
  }
}
