package com.acme.relay.workorder;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Payload appended to the target queue for the downstream executor. Carries no identity or
 * timestamp: two work orders built from the same inputs are equal and encode to the same bytes.
 */
@JsonPropertyOrder({"repo", "branch", "type", "dir", "commands"})
public record WorkOrder(String repo, String branch, String type, String dir, List<String> commands) {

  public WorkOrder {
    commands = commands == null ? List.of() : List.copyOf(commands);
  }
}
