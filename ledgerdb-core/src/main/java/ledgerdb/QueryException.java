package ledgerdb;

/**
 * Unchecked exception wrapping JDBC errors raised while preparing, executing
 * or mapping the results of a statement.
 */
public final class QueryException extends LedgerDbException {
  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
