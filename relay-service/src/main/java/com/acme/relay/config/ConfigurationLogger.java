package com.acme.relay.config;

import com.acme.relay.registry.ProjectRegistry;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final RelayConfig relayConfig;
  private final ProjectRegistry registry;

  @Property(name = "micronaut.server.port", defaultValue = "8080")
  private int serverPort;

  @Property(name = "redisson.address", defaultValue = "")
  private String redisAddress;

  @Property(name = "redisson.password", defaultValue = "")
  private String redisPassword;

  public ConfigurationLogger(RelayConfig relayConfig, ProjectRegistry registry) {
    this.relayConfig = relayConfig;
    this.registry = registry;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("━━━ Relay Configuration ━━━");
    LOG.info("  HTTP Port:          {} (POST /messages)", serverPort);
    LOG.info("  Redis Address:      {}", redisAddress);
    LOG.info("  Redis Password:     {}", redisPassword.isEmpty() ? "(none)" : "****");
    LOG.info("  Source Queue:       {} (directives consumed with BLPOP)", relayConfig.getSourceQueue());
    LOG.info("  Default Target:     {} (work orders pushed with RPUSH)", relayConfig.getDefaultTargetQueue());
    LOG.info("  Registry File:      {} ({} projects)", relayConfig.getRegistryFile(), registry.size());
    LOG.info("  Consumer:           {}", relayConfig.isConsumerEnabled() ? "ENABLED" : "DISABLED");
    LOG.info("  Poll Timeout:       {}", relayConfig.getPollTimeout());
    LOG.info("  Error Backoff:      {}", relayConfig.getErrorBackoff());
    LOG.info("  Shutdown Grace:     {}", relayConfig.getShutdownGracePeriod());
  }
}
