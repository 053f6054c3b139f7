package com.acme.relay.consumer;

import com.acme.relay.dispatch.DispatchException;
import com.acme.relay.dispatch.Dispatcher;
import com.acme.relay.dispatch.InvalidDirectiveException;
import com.acme.relay.spi.QueueStore;
import com.acme.relay.spi.QueueStoreException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running loop that takes directives from the head of the source queue and hands each one to
 * the {@link Dispatcher}. Runs on a dedicated thread.
 *
 * <p>The blocking read is bounded by {@code pollTimeout} so that {@link #stop()} is observed
 * within one poll interval. A message that fails to parse or dispatch is logged and dropped; it is
 * never requeued. Read failures back off for {@code errorBackoff} before the next attempt.
 */
public class QueueConsumer {
  private static final Logger log = LoggerFactory.getLogger(QueueConsumer.class);

  private final QueueStore store;
  private final Dispatcher dispatcher;
  private final String sourceQueue;
  private final Duration pollTimeout;
  private final Duration errorBackoff;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final ExecutorService executor =
      Executors.newSingleThreadExecutor(
          r -> {
            Thread t = new Thread(r, "directive-consumer");
            t.setDaemon(true);
            return t;
          });

  public QueueConsumer(
      QueueStore store,
      Dispatcher dispatcher,
      String sourceQueue,
      Duration pollTimeout,
      Duration errorBackoff) {
    this.store = store;
    this.dispatcher = dispatcher;
    this.sourceQueue = sourceQueue;
    this.pollTimeout = pollTimeout;
    this.errorBackoff = errorBackoff;
  }

  /** Starts the loop on its own thread. Ignored if already started or stopped. */
  public void start() {
    if (stopSignal.getCount() == 0 || !started.compareAndSet(false, true)) {
      return;
    }
    running.set(true);
    log.info("Listening for messages on list: {}", sourceQueue);
    executor.execute(this::runLoop);
    executor.shutdown();
  }

  /**
   * Signals the loop to exit. A dispatch already under way completes; no further read starts.
   * Does not wait, see {@link #awaitTermination(Duration)}.
   */
  public void stop() {
    running.set(false);
    stopSignal.countDown();
    if (!started.get()) {
      terminated.countDown();
    }
  }

  /**
   * Waits up to {@code timeout} for the loop to exit. If it has not, the consumer thread is
   * interrupted so a blocked read is abandoned.
   *
   * @return {@code true} if the loop exited within {@code timeout}
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return true;
    }
    log.warn("Consumer did not stop within {}; interrupting", timeout);
    executor.shutdownNow();
    return false;
  }

  public boolean isRunning() {
    return running.get();
  }

  void runLoop() {
    try {
      while (running.get()) {
        Optional<String> message;
        try {
          message = store.pollHead(sourceQueue, pollTimeout);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        } catch (QueueStoreException e) {
          log.error("Error reading from {}: {}", sourceQueue, e.getMessage());
          backOff();
          continue;
        } catch (RuntimeException e) {
          log.error("Unexpected error reading from {}", sourceQueue, e);
          backOff();
          continue;
        }
        message.ifPresent(this::handle);
      }
    } finally {
      running.set(false);
      terminated.countDown();
      log.info("Stopped consuming from {}", sourceQueue);
    }
  }

  void handle(String message) {
    log.info("Received message: {}", message);
    try {
      dispatcher.dispatch(message);
    } catch (InvalidDirectiveException e) {
      log.warn("Dropping invalid message from {}: {}", sourceQueue, e.getMessage());
    } catch (DispatchException e) {
      log.error("Error processing message: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error processing message from {}", sourceQueue, e);
    }
  }

  private void backOff() {
    try {
      stopSignal.await(errorBackoff.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.set(false);
    }
  }
}
