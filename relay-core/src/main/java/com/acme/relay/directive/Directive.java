package com.acme.relay.directive;

import com.acme.relay.core.Jsons;
import com.acme.relay.dispatch.InvalidDirectiveException;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound lifecycle request, as read from the source queue or an HTTP body. At most one of the
 * three fields is expected to hold a repository identifier; {@link #target()} enforces that.
 */
public record Directive(String up, String down, String restart) {

  public static Directive up(String repositoryId) {
    return new Directive(repositoryId, null, null);
  }

  public static Directive down(String repositoryId) {
    return new Directive(null, repositoryId, null);
  }

  public static Directive restart(String repositoryId) {
    return new Directive(null, null, repositoryId);
  }

  /**
   * Decodes inbound directive JSON. Unknown fields are ignored.
   *
   * @throws InvalidDirectiveException if the text is not a JSON object
   */
  public static Directive parse(String json) {
    if (json == null || json.isBlank()) {
      throw new InvalidDirectiveException("Invalid JSON: empty body");
    }
    Directive directive;
    try {
      directive = Jsons.fromJson(json, Directive.class);
    } catch (IllegalArgumentException e) {
      throw new InvalidDirectiveException("Invalid JSON: " + e.getMessage(), e);
    }
    if (directive == null) {
      throw new InvalidDirectiveException("Invalid JSON: expected an object");
    }
    return directive;
  }

  /**
   * Returns the single populated action.
   *
   * @throws InvalidDirectiveException if no field or more than one field is populated
   */
  public DirectiveTarget target() {
    List<DirectiveTarget> populated = new ArrayList<>(1);
    addIfPresent(populated, Action.UP, up);
    addIfPresent(populated, Action.DOWN, down);
    addIfPresent(populated, Action.RESTART, restart);

    if (populated.isEmpty()) {
      throw new InvalidDirectiveException(
          "Message must contain either 'up', 'down', or 'restart' field");
    }
    if (populated.size() > 1) {
      throw new InvalidDirectiveException(
          "Message must contain only one of 'up', 'down', or 'restart' field");
    }
    return populated.get(0);
  }

  private static void addIfPresent(List<DirectiveTarget> out, Action action, String value) {
    if (value != null && !value.isEmpty()) {
      out.add(new DirectiveTarget(action, value));
    }
  }
}
