package com.acme.relay.registry;

import com.acme.relay.directive.Action;
import java.util.List;

/**
 * Execution descriptor for one repository: where its service lives and which commands bring it
 * up, down or restart it. Missing command lists are normalised to empty lists.
 */
public record ProjectDescriptor(
    String repo,
    String dir,
    List<String> upCommands,
    List<String> downCommands,
    List<String> restartCommands,
    String targetQueue) {

  public ProjectDescriptor {
    upCommands = copyOf(upCommands);
    downCommands = copyOf(downCommands);
    restartCommands = copyOf(restartCommands);
  }

  public List<String> commandsFor(Action action) {
    return switch (action) {
      case UP -> upCommands;
      case DOWN -> downCommands;
      case RESTART -> restartCommands;
    };
  }

  /** The per-project queue override when one is set, otherwise {@code defaultQueue}. */
  public String targetQueueOr(String defaultQueue) {
    return targetQueue == null || targetQueue.isEmpty() ? defaultQueue : targetQueue;
  }

  private static List<String> copyOf(List<String> commands) {
    return commands == null ? List.of() : List.copyOf(commands);
  }
}
