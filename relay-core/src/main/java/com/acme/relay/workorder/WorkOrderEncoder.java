package com.acme.relay.workorder;

import com.acme.relay.core.Jsons;
import com.acme.relay.directive.Action;
import com.acme.relay.registry.ProjectDescriptor;

/** Translates a resolved directive into the work order the executor consumes. Stateless. */
public class WorkOrderEncoder {

  /** Branch reference stamped on every work order; not derived from the directive. */
  public static final String BRANCH = "refs/heads/main";

  public WorkOrder build(String repositoryId, Action action, ProjectDescriptor descriptor) {
    return new WorkOrder(
        repositoryId,
        BRANCH,
        action.workOrderType(),
        descriptor.dir(),
        descriptor.commandsFor(action));
  }

  public String encode(WorkOrder workOrder) {
    return Jsons.toJson(workOrder);
  }
}
