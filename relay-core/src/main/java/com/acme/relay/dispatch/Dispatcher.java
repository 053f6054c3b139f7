package com.acme.relay.dispatch;

import com.acme.relay.directive.Directive;
import com.acme.relay.directive.DirectiveTarget;
import com.acme.relay.registry.ProjectDescriptor;
import com.acme.relay.registry.ProjectRegistry;
import com.acme.relay.spi.QueueStore;
import com.acme.relay.workorder.WorkOrder;
import com.acme.relay.workorder.WorkOrderEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point shared by the queue consumer and the HTTP ingress. Validates a directive,
 * resolves it against the registry, encodes the work order and appends it to the target queue.
 *
 * <p>Holds only immutable collaborators, so concurrent calls need no locking. A successful call
 * performs exactly one append; a failed call performs none, except when the append itself fails.
 */
public class Dispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

  private final ProjectRegistry registry;
  private final WorkOrderEncoder encoder;
  private final QueueStore store;
  private final String defaultTargetQueue;

  public Dispatcher(
      ProjectRegistry registry,
      WorkOrderEncoder encoder,
      QueueStore store,
      String defaultTargetQueue) {
    this.registry = registry;
    this.encoder = encoder;
    this.store = store;
    this.defaultTargetQueue = defaultTargetQueue;
  }

  public String getDefaultTargetQueue() {
    return defaultTargetQueue;
  }

  /** Parses raw directive JSON and dispatches it. */
  public DispatchResult dispatch(String rawDirective) {
    return dispatch(Directive.parse(rawDirective));
  }

  /**
   * @throws InvalidDirectiveException if not exactly one action is populated
   * @throws UnknownRepositoryException if the registry has no entry for the repository
   * @throws DeliveryFailedException if the target queue append fails
   */
  public DispatchResult dispatch(Directive directive) {
    DirectiveTarget target = directive.target();
    String repo = target.repositoryId();

    ProjectDescriptor project =
        registry.lookup(repo).orElseThrow(() -> new UnknownRepositoryException(repo));

    LOG.info("Processing {} command for {}", target.action(), repo);

    String targetQueue = project.targetQueueOr(defaultTargetQueue);
    WorkOrder workOrder = encoder.build(repo, target.action(), project);
    String payload = encoder.encode(workOrder);

    try {
      store.append(targetQueue, payload);
    } catch (RuntimeException e) {
      throw new DeliveryFailedException(targetQueue, e);
    }

    LOG.info("Sent notification to {} for {} ({})", targetQueue, repo, target.action());
    return new DispatchResult(targetQueue, workOrder, payload);
  }
}
