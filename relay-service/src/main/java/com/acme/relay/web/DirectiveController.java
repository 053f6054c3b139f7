package com.acme.relay.web;

import com.acme.relay.dispatch.DispatchResult;
import com.acme.relay.dispatch.Dispatcher;
import com.acme.relay.lifecycle.InFlightRequests;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Consumes;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP ingress for directives. The response is written only after the work order has been pushed,
 * so a 200 means the target queue holds it. Dispatch failures are mapped by
 * {@link DispatchExceptionHandler}.
 */
@Slf4j
@Controller("/messages")
@RequiredArgsConstructor
public class DirectiveController {

  private final Dispatcher dispatcher;
  private final InFlightRequests inFlight;

  @Post
  @Consumes({MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN})
  @ExecuteOn(TaskExecutors.BLOCKING)
  public HttpResponse<?> submit(@Nullable @Body String body) {
    if (!inFlight.tryEnter()) {
      log.warn("Refusing directive, service is shutting down");
      return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(
              new ErrorResponse(
                  "Service is shutting down", HttpStatus.SERVICE_UNAVAILABLE.getCode()));
    }
    try {
      log.info("Received HTTP message: {}", body);
      DispatchResult result = dispatcher.dispatch(body);
      log.debug("HTTP directive forwarded to {}", result.targetQueue());
      return HttpResponse.ok(DispatchStatus.success());
    } finally {
      inFlight.exit();
    }
  }
}
