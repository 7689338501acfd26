package ledgerdb.spi;

import ledgerdb.Database;

/**
 * A collaborator that owns tables in the backing store and can drop and
 * recreate them during {@link Database#initialize()}.
 */
public interface SchemaOwner {

  /**
   * Stage name used when reporting a failed reset (e.g., "accounts").
   */
  String name();

  /**
   * Drops and recreates the tables this owner manages.
   */
  void dropAll(Database database);
}
