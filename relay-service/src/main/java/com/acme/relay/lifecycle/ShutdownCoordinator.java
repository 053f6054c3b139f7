package com.acme.relay.lifecycle;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.consumer.QueueConsumer;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.ShutdownEvent;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Orderly stop on SIGINT/SIGTERM. Micronaut's shutdown hook closes the context, which publishes
 * {@link ShutdownEvent}:
 *
 * <ol>
 *   <li>HTTP ingress stops admitting directives; in-flight ones get up to the grace period.
 *   <li>The queue consumer is told to stop.
 *   <li>The consumer gets up to the grace period to finish its current message.
 * </ol>
 *
 * Runs at most once.
 */
@Slf4j
@Singleton
public class ShutdownCoordinator implements ApplicationEventListener<ShutdownEvent> {

  private final InFlightRequests inFlight;
  private final QueueConsumer consumer;
  private final Duration gracePeriod;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  public ShutdownCoordinator(InFlightRequests inFlight, QueueConsumer consumer, RelayConfig config) {
    this.inFlight = inFlight;
    this.consumer = consumer;
    this.gracePeriod = config.getShutdownGracePeriod();
  }

  @Override
  public void onApplicationEvent(ShutdownEvent event) {
    shutdown();
  }

  /** @return {@code true} if HTTP requests and the consumer both finished within the grace period */
  public boolean shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return true;
    }
    log.info("Received shutdown signal, cleaning up...");
    boolean clean = true;
    try {
      if (!inFlight.drain(gracePeriod)) {
        log.warn("{} HTTP requests still in flight after {}", inFlight.active(), gracePeriod);
        clean = false;
      }
      consumer.stop();
      if (!consumer.awaitTermination(gracePeriod)) {
        clean = false;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      consumer.stop();
      clean = false;
    }
    log.info("Shutting down...");
    return clean;
  }

  public boolean isShutdown() {
    return shutdown.get();
  }
}
