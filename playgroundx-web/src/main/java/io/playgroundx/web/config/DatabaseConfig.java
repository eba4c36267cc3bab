package io.playgroundx.web.config;

import io.playgroundx.web.db.ConnectorRegistry;
import io.playgroundx.web.db.DatabaseTarget;
import io.playgroundx.web.health.StartupHealthCheck;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class DatabaseConfig {

  @Bean(destroyMethod = "close")
  public ConnectorRegistry connectorRegistry(DatabaseProperties props) {
    validate(props);
    return new ConnectorRegistry(props);
  }

  @Bean
  @ConditionalOnProperty(prefix = "playgroundx.db", name = "verify-on-startup", havingValue = "true")
  public StartupHealthCheck startupHealthCheck(ConnectorRegistry registry) {
    return new StartupHealthCheck(registry);
  }

  /** Primary credentials are mandatory; the secondary target may be left out entirely. */
  static void validate(DatabaseProperties props) {
    List<String> missing = props.getPrimary().credentials().missingFields();
    if (!missing.isEmpty()) {
      throw new ConfigurationException("Missing required configuration for " + DatabaseTarget.PRIMARY.key()
          + " database: " + missing);
    }
    if (props.getSecondary().isConfigured()) {
      List<String> missingSecondary = props.getSecondary().credentials().missingFields();
      if (!missingSecondary.isEmpty()) {
        throw new ConfigurationException("Incomplete configuration for " + DatabaseTarget.SECONDARY.key()
            + " database: " + missingSecondary);
      }
    }
    try {
      props.getPrimary().poolSettings();
      props.getSecondary().poolSettings();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid pool settings: " + e.getMessage());
    }
  }
}
