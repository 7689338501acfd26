package ledgerdb;

/**
 * Thrown when a session (primary or pooled) cannot be opened or tuned.
 */
public final class ConnectionException extends LedgerDbException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
