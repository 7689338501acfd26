package ledgerdb.jdbc.backend;

import ledgerdb.spi.BackendKind;

import java.util.List;

/**
 * PostgreSQL backend (networked).
 */
public final class PostgresBackend extends AbstractBackend {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public BackendKind kind() {
    return BackendKind.NETWORKED;
  }

  @Override
  public String driverClassName() {
    return "org.postgresql.Driver";
  }
}
