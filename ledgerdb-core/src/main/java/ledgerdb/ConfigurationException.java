package ledgerdb;

/**
 * Thrown when the configured backend URL does not support the requested
 * operation, e.g. a connection pool over a private in-memory store.
 */
public final class ConfigurationException extends LedgerDbException {
  public ConfigurationException(String message) {
    super(message);
  }
}
