package com.acme.relay.config;

import java.time.Duration;

/**
 * Queue names, registry location and timing settings for the relay. Pure POJO - no framework
 * dependencies.
 */
public class RelayConfig {

  private String sourceQueue = "service:commands";
  private String defaultTargetQueue = "poppit:notifications";
  private String registryFile = "projects.json";
  private Duration pollTimeout = Duration.ofSeconds(5); // Upper bound on shutdown latency
  private Duration errorBackoff = Duration.ofSeconds(1);
  private Duration shutdownGracePeriod = Duration.ofSeconds(5);
  private boolean consumerEnabled = true;

  public String getSourceQueue() {
    return sourceQueue;
  }

  public void setSourceQueue(String sourceQueue) {
    this.sourceQueue = sourceQueue;
  }

  public String getDefaultTargetQueue() {
    return defaultTargetQueue;
  }

  public void setDefaultTargetQueue(String defaultTargetQueue) {
    this.defaultTargetQueue = defaultTargetQueue;
  }

  public String getRegistryFile() {
    return registryFile;
  }

  public void setRegistryFile(String registryFile) {
    this.registryFile = registryFile;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public Duration getErrorBackoff() {
    return errorBackoff;
  }

  public void setErrorBackoff(Duration errorBackoff) {
    this.errorBackoff = errorBackoff;
  }

  public Duration getShutdownGracePeriod() {
    return shutdownGracePeriod;
  }

  public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
    this.shutdownGracePeriod = shutdownGracePeriod;
  }

  public boolean isConsumerEnabled() {
    return consumerEnabled;
  }

  public void setConsumerEnabled(boolean consumerEnabled) {
    this.consumerEnabled = consumerEnabled;
  }
}
