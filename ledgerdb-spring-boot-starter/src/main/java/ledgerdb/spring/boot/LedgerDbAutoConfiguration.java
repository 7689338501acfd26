package ledgerdb.spring.boot;

import ledgerdb.Database;
import ledgerdb.spi.MetricsRecorder;
import ledgerdb.spi.SchemaOwner;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the ledger database manager.
 *
 * <p>Builds a {@link Database} from {@link LedgerDbProperties} when
 * {@code ledgerdb.url} is set. Every {@link SchemaOwner} bean is registered in
 * bean order, and a {@link MetricsRecorder} bean, if present, receives timer samples.
 *
 * @see LedgerDbProperties
 * @see LedgerDbMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Database.class)
@ConditionalOnProperty(prefix = "ledgerdb", name = "url")
@EnableConfigurationProperties(LedgerDbProperties.class)
public class LedgerDbAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Database database(
      LedgerDbProperties props,
      ObjectProvider<SchemaOwner> schemaOwners,
      ObjectProvider<MetricsRecorder> metricsRecorder) {
    Database.Builder builder = Database.builder()
        .url(props.getUrl())
        .metrics(metricsRecorder.getIfAvailable(() -> MetricsRecorder.NOOP))
        .poolSize(props.getPool().getSize())
        .poolAcquireTimeout(props.getPool().getAcquireTimeout());
    schemaOwners.orderedStream().forEach(builder::schemaOwner);
    return builder.build();
  }
}
