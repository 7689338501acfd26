package ledgerdb;

/**
 * Thrown when process-wide backend driver registration fails. Fatal to startup.
 */
public final class InitializationException extends LedgerDbException {
  public InitializationException(String message) {
    super(message);
  }

  public InitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
