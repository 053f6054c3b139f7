package com.acme.relay.spi;

/**
 * Communication with the queue store failed. On the read side this means the source queue is
 * unavailable; the consumer backs off and retries.
 */
public class QueueStoreException extends RuntimeException {

  public QueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
