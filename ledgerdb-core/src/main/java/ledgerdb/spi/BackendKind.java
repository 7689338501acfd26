package ledgerdb.spi;

/**
 * Transactional and durability family of a {@link Backend}.
 */
public enum BackendKind {
  /** In-process file or memory store; single writer, journaled through a write-ahead log. */
  EMBEDDED,
  /** Client/server store supporting concurrent serializable transactions. */
  NETWORKED
}
