package com.acme.relay.spi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory FIFO store for tests. Failures can be injected for a number of calls. */
public class InMemoryQueueStore implements QueueStore {

  private final ConcurrentHashMap<String, LinkedBlockingDeque<String>> queues =
      new ConcurrentHashMap<>();
  private final AtomicInteger failingAppends = new AtomicInteger();
  private final AtomicInteger failingPolls = new AtomicInteger();
  private final AtomicInteger pollCount = new AtomicInteger();

  @Override
  public void append(String queue, String payload) {
    if (failingAppends.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new QueueStoreException("connection refused", new RuntimeException("connection refused"));
    }
    queue(queue).addLast(payload);
  }

  @Override
  public Optional<String> pollHead(String queue, Duration timeout) throws InterruptedException {
    pollCount.incrementAndGet();
    if (failingPolls.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new QueueStoreException("connection refused", new RuntimeException("connection refused"));
    }
    return Optional.ofNullable(queue(queue).pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public void failNextAppends(int count) {
    failingAppends.set(count);
  }

  public void failNextPolls(int count) {
    failingPolls.set(count);
  }

  public int pollCount() {
    return pollCount.get();
  }

  public List<String> contents(String queue) {
    return new ArrayList<>(queue(queue));
  }

  public int size(String queue) {
    return queue(queue).size();
  }

  private LinkedBlockingDeque<String> queue(String name) {
    return queues.computeIfAbsent(name, k -> new LinkedBlockingDeque<>());
  }
}
