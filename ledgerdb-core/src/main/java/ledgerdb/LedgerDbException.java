package ledgerdb;

/**
 * Base class of the unchecked exceptions thrown by ledgerdb.
 *
 * <p>None of them is retried or recovered internally; each surfaces to the
 * immediate caller.
 */
public class LedgerDbException extends RuntimeException {
  public LedgerDbException(String message) {
    super(message);
  }

  public LedgerDbException(String message, Throwable cause) {
    super(message, cause);
  }
}
