package com.acme.relay.dispatch;

/**
 * Base of the failures {@link Dispatcher#dispatch} reports. Callers decide what a failure means
 * for their channel: the queue consumer logs and drops, the HTTP ingress maps to a status code.
 */
public abstract class DispatchException extends RuntimeException {

  protected DispatchException(String message) {
    super(message);
  }

  protected DispatchException(String message, Throwable cause) {
    super(message, cause);
  }

  /** {@code true} when the same directive would fail the same way if submitted again. */
  public abstract boolean isPermanent();
}
