package com.acme.relay.config;

import com.acme.relay.consumer.QueueConsumer;
import com.acme.relay.dispatch.Dispatcher;
import com.acme.relay.registry.ProjectRegistry;
import com.acme.relay.registry.RegistryLoadException;
import com.acme.relay.registry.RegistryLoader;
import com.acme.relay.spi.QueueStore;
import com.acme.relay.workorder.WorkOrderEncoder;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.core.io.ResourceResolver;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * Wires the framework-free relay core into Micronaut.
 *
 * <p>The core module has no DI annotations; everything it needs is created here.
 */
@Factory
public class CoreBeansFactory {

  static final String CLASSPATH_PREFIX = "classpath:";
  static final String FILE_PREFIX = "file:";

  /**
   * Creates RelayConfig bean from application.yml relay.* properties. Properties that are not set
   * keep the RelayConfig defaults.
   */
  @Singleton
  public RelayConfig relayConfig(
      @Nullable @Property(name = "relay.source-queue") String sourceQueue,
      @Nullable @Property(name = "relay.default-target-queue") String defaultTargetQueue,
      @Nullable @Property(name = "relay.registry-file") String registryFile,
      @Nullable @Property(name = "relay.poll-timeout") Duration pollTimeout,
      @Nullable @Property(name = "relay.error-backoff") Duration errorBackoff,
      @Nullable @Property(name = "relay.shutdown-grace-period") Duration shutdownGracePeriod,
      @Nullable @Property(name = "relay.consumer-enabled") Boolean consumerEnabled) {
    RelayConfig config = new RelayConfig();
    if (sourceQueue != null) {
      config.setSourceQueue(sourceQueue);
    }
    if (defaultTargetQueue != null) {
      config.setDefaultTargetQueue(defaultTargetQueue);
    }
    if (registryFile != null) {
      config.setRegistryFile(registryFile);
    }
    if (pollTimeout != null) {
      config.setPollTimeout(pollTimeout);
    }
    if (errorBackoff != null) {
      config.setErrorBackoff(errorBackoff);
    }
    if (shutdownGracePeriod != null) {
      config.setShutdownGracePeriod(shutdownGracePeriod);
    }
    if (consumerEnabled != null) {
      config.setConsumerEnabled(consumerEnabled);
    }
    return config;
  }

  @Singleton
  public RegistryLoader registryLoader() {
    return new RegistryLoader();
  }

  @Singleton
  public WorkOrderEncoder workOrderEncoder() {
    return new WorkOrderEncoder();
  }

  /**
   * Loads the project registry once. Eager so that a missing or malformed registry file stops the
   * application before it accepts traffic.
   */
  @Context
  public ProjectRegistry projectRegistry(RelayConfig config, RegistryLoader loader) {
    String location = config.getRegistryFile();
    InputStream stream =
        new ResourceResolver()
            .getResourceAsStream(resolvableLocation(location))
            .orElseThrow(
                () -> new RegistryLoadException("failed to read config file: " + location));
    try (InputStream in = stream) {
      return loader.load(in, location);
    } catch (IOException e) {
      throw new RegistryLoadException("failed to read config file: " + location, e);
    }
  }

  @Singleton
  public Dispatcher dispatcher(
      ProjectRegistry registry, WorkOrderEncoder encoder, QueueStore store, RelayConfig config) {
    return new Dispatcher(registry, encoder, store, config.getDefaultTargetQueue());
  }

  @Singleton
  public QueueConsumer queueConsumer(QueueStore store, Dispatcher dispatcher, RelayConfig config) {
    return new QueueConsumer(
        store,
        dispatcher,
        config.getSourceQueue(),
        config.getPollTimeout(),
        config.getErrorBackoff());
  }

  // Bare paths are read from the filesystem, relative to the working directory.
  static String resolvableLocation(String location) {
    if (location.startsWith(CLASSPATH_PREFIX) || location.startsWith(FILE_PREFIX)) {
      return location;
    }
    return FILE_PREFIX + location;
  }
}
