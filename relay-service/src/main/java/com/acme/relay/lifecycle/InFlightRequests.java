package com.acme.relay.lifecycle;

import jakarta.inject.Singleton;
import java.time.Duration;

/**
 * Counts HTTP directives being dispatched so shutdown can let them finish. Once draining starts,
 * {@link #tryEnter()} refuses new work.
 */
@Singleton
public class InFlightRequests {

  private final Object lock = new Object();
  private int active;
  private boolean draining;

  /** @return {@code false} if the service is draining and the request must be refused */
  public boolean tryEnter() {
    synchronized (lock) {
      if (draining) {
        return false;
      }
      active++;
      return true;
    }
  }

  public void exit() {
    synchronized (lock) {
      active--;
      if (active == 0) {
        lock.notifyAll();
      }
    }
  }

  /**
   * Stops admitting requests and waits up to {@code timeout} for the active ones to finish.
   *
   * @return {@code true} if no request was still active when this returned
   */
  public boolean drain(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (lock) {
      draining = true;
      while (active > 0) {
        long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
        if (remainingMillis <= 0) {
          return false;
        }
        lock.wait(remainingMillis);
      }
      return true;
    }
  }

  public int active() {
    synchronized (lock) {
      return active;
    }
  }

  public boolean isDraining() {
    synchronized (lock) {
      return draining;
    }
  }
}
