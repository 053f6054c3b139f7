package com.acme.relay.redis;

import com.acme.relay.spi.QueueStore;
import com.acme.relay.spi.QueueStoreException;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueueStore} over Redis lists. Appends are RPUSH, reads are BLPOP, both with a plain
 * string codec so producers and the executor see the raw JSON text. The Redisson client is
 * thread-safe and shared by the consumer thread and request threads.
 */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedissonQueueStore implements QueueStore {
  private static final Logger LOG = LoggerFactory.getLogger(RedissonQueueStore.class);

  private final RedissonClient redisson;

  public RedissonQueueStore(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public void append(String queue, String payload) {
    try {
      redisson.getList(queue, StringCodec.INSTANCE).add(payload);
      LOG.debug("Appended {} bytes to {}", payload.length(), queue);
    } catch (RuntimeException e) {
      throw new QueueStoreException(e.getMessage(), e);
    }
  }

  @Override
  public Optional<String> pollHead(String queue, Duration timeout) throws InterruptedException {
    try {
      String message =
          redisson
              .<String>getBlockingQueue(queue, StringCodec.INSTANCE)
              .poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return Optional.ofNullable(message);
    } catch (RuntimeException e) {
      throw new QueueStoreException(e.getMessage(), e);
    }
  }
}
