package com.acme.relay.dispatch;

/** The work order could not be appended to its target queue. Not retried by the dispatcher. */
public class DeliveryFailedException extends DispatchException {
  private final String targetQueue;

  public DeliveryFailedException(String targetQueue, Throwable cause) {
    super("failed to push notification to " + targetQueue + ": " + cause.getMessage(), cause);
    this.targetQueue = targetQueue;
  }

  public String getTargetQueue() {
    return targetQueue;
  }

  @Override
  public boolean isPermanent() {
    return false;
  }
}
