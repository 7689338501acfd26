package ledgerdb.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the ledger database manager.
 *
 * @see LedgerDbAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledgerdb")
public class LedgerDbProperties {

  /**
   * JDBC URL of the backing store, e.g. {@code jdbc:sqlite:/var/lib/ledger/ledger.db}.
   */
  private String url;

  private final Pool pool = new Pool();
  private final Metrics metrics = new Metrics();

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public Pool getPool() {
    return pool;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Pool {
    /**
     * Number of pooled sessions. 0 uses the number of available processors.
     */
    private int size;

    /**
     * Maximum wait for a free pooled session. Unset waits without limit.
     */
    private Duration acquireTimeout;

    public int getSize() {
      return size;
    }

    public void setSize(int size) {
      this.size = size;
    }

    public Duration getAcquireTimeout() {
      return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "database";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
