package com.acme.relay.directive;

/** Lifecycle action a directive asks for. */
public enum Action {
  UP("up"),
  DOWN("down"),
  RESTART("restart");

  private final String wireName;

  Action(String wireName) {
    this.wireName = wireName;
  }

  /** Field name used in inbound directive JSON. */
  public String wireName() {
    return wireName;
  }

  /** Value of the {@code type} field in the emitted work order, e.g. {@code service-up}. */
  public String workOrderType() {
    return "service-" + wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
