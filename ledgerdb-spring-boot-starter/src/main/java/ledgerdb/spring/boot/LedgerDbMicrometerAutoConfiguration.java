package ledgerdb.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import ledgerdb.micrometer.MicrometerMetricsRecorder;
import ledgerdb.spi.MetricsRecorder;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsRecorder} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code ledgerdb.metrics.enabled} is true (default).
 *
 * <p>Runs after the actuator registry auto-configurations, so their
 * {@link MeterRegistry} is visible, and before {@link LedgerDbAutoConfiguration}
 * so the {@link MetricsRecorder} bean is available for injection into the {@code Database}.
 */
@AutoConfiguration(
    before = LedgerDbAutoConfiguration.class,
    afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"})
@ConditionalOnClass({MicrometerMetricsRecorder.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "ledgerdb.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerDbProperties.class)
public class LedgerDbMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsRecorder.class)
  public MicrometerMetricsRecorder micrometerMetricsRecorder(
      MeterRegistry meterRegistry, LedgerDbProperties props) {
    return new MicrometerMetricsRecorder(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
