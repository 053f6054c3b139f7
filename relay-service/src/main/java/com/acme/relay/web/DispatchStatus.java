package com.acme.relay.web;

/** Body returned once a directive has been forwarded. */
public record DispatchStatus(String status, String message) {

  public static DispatchStatus success() {
    return new DispatchStatus("success", "Message processed successfully");
  }
}
