package com.acme.relay.dispatch;

/** Directive is malformed JSON or does not name exactly one action. */
public class InvalidDirectiveException extends DispatchException {

  public InvalidDirectiveException(String message) {
    super(message);
  }

  public InvalidDirectiveException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isPermanent() {
    return true;
  }
}
