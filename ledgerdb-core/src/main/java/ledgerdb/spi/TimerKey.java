package ledgerdb.spi;

import ledgerdb.metrics.OperationCategory;

import java.util.Objects;

/**
 * Hierarchical metric key {@code (namespace, category, entityName)}, e.g.
 * {@code (database, select, account)}.
 */
public record TimerKey(String namespace, OperationCategory category, String entityName) {

  public TimerKey {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(entityName, "entityName");
  }
}
