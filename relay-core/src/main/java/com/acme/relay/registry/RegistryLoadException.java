package com.acme.relay.registry;

/** The project registry source could not be read or parsed. Fatal at startup. */
public class RegistryLoadException extends RuntimeException {

  public RegistryLoadException(String message) {
    super(message);
  }

  public RegistryLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
