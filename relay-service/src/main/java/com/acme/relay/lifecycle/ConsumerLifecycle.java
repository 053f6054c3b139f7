package com.acme.relay.lifecycle;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.consumer.QueueConsumer;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Starts the queue consumer once the HTTP server is listening. */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class ConsumerLifecycle implements ApplicationEventListener<ServerStartupEvent> {

  private final QueueConsumer consumer;
  private final RelayConfig config;

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    if (!config.isConsumerEnabled()) {
      log.info("Queue consumer disabled (relay.consumer-enabled=false)");
      return;
    }
    consumer.start();
  }
}
