package ledgerdb.metrics;

/**
 * Category of a timed database operation.
 */
public enum OperationCategory {
  INSERT("insert"),
  SELECT("select"),
  DELETE("delete"),
  UPDATE("update");

  private final String key;

  OperationCategory(String key) {
    this.key = key;
  }

  /**
   * Lower-case name used as the category segment of a metric key.
   */
  public String key() {
    return key;
  }
}
