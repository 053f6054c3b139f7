package com.acme.relay;

import io.micronaut.runtime.Micronaut;

/**
 * Relay service: accepts up/down/restart directives from the source Redis list and from
 * {@code POST /messages}, and forwards the matching work order to the project's target queue.
 */
public class RelayApplication {
  public static void main(String[] args) {
    Micronaut.run(RelayApplication.class, args);
  }
}
