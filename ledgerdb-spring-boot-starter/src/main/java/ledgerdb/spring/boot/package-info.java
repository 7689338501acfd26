/**
 * Spring Boot auto-configuration for the ledger database manager.
 *
 * <p>{@link ledgerdb.spring.boot.LedgerDbAutoConfiguration} builds a {@link ledgerdb.Database}
 * from {@code ledgerdb.*} application properties.
 *
 * @see ledgerdb.spring.boot.LedgerDbAutoConfiguration
 * @see ledgerdb.spring.boot.LedgerDbProperties
 */
package ledgerdb.spring.boot;
