package docbuild.spring.boot;

import docbuild.micrometer.MicrometerMetricsExporter;
import docbuild.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code docbuild.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DocBuildAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the DocBuild composite.
 */
@AutoConfiguration(before = DocBuildAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "docbuild.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DocBuildProperties.class)
public class DocBuildMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, DocBuildProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
