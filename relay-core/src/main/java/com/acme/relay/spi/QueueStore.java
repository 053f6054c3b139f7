package com.acme.relay.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * FIFO list store shared by the relay's producers and consumer. Producers append to the tail, the
 * consumer takes from the head. Implementations must tolerate concurrent calls from the queue
 * consumer thread and any number of HTTP request threads.
 */
public interface QueueStore {

  /**
   * Appends {@code payload} to the tail of {@code queue} as a single atomic operation.
   *
   * @throws QueueStoreException if the store cannot be reached or rejects the write
   */
  void append(String queue, String payload);

  /**
   * Removes and returns the head of {@code queue}, waiting up to {@code timeout} for one to
   * arrive.
   *
   * @return the message, or empty if none arrived within {@code timeout}
   * @throws QueueStoreException on any failure other than the timeout
   * @throws InterruptedException if the waiting thread is interrupted
   */
  Optional<String> pollHead(String queue, Duration timeout) throws InterruptedException;
}
