package ledgerdb.jdbc.backend;

import ledgerdb.spi.BackendKind;

import java.util.List;

/**
 * MySQL backend (networked). Also handles TiDB URLs, which speak the MySQL protocol.
 */
public final class MySqlBackend extends AbstractBackend {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public BackendKind kind() {
    return BackendKind.NETWORKED;
  }

  @Override
  public String driverClassName() {
    return "com.mysql.cj.jdbc.Driver";
  }
}
