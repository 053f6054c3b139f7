package com.acme.relay.lifecycle;

import static org.mockito.Mockito.*;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.consumer.QueueConsumer;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConsumerLifecycle Tests")
class ConsumerLifecycleTest {

  private final QueueConsumer consumer = mock(QueueConsumer.class);
  private final RelayConfig config = new RelayConfig();

  @Test
  @DisplayName("Should start the consumer once the server is up")
  void testStartsConsumer() {
    new ConsumerLifecycle(consumer, config).onApplicationEvent(mock(ServerStartupEvent.class));

    verify(consumer).start();
  }

  @Test
  @DisplayName("Should leave the consumer idle when disabled")
  void testDisabled() {
    config.setConsumerEnabled(false);

    new ConsumerLifecycle(consumer, config).onApplicationEvent(mock(ServerStartupEvent.class));

    verifyNoInteractions(consumer);
  }
}
