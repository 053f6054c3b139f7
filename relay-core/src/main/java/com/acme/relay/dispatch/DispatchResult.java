package com.acme.relay.dispatch;

import com.acme.relay.workorder.WorkOrder;

/** What a successful dispatch appended, and where. */
public record DispatchResult(String targetQueue, WorkOrder workOrder, String payload) {}
