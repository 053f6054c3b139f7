package com.acme.relay.web;

import com.acme.relay.dispatch.DispatchException;
import com.acme.relay.dispatch.InvalidDirectiveException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps dispatch failures to HTTP responses.
 *
 * <p>Invalid directives -> 400 BAD REQUEST with the validation message. Unknown repositories and
 * delivery failures -> 500 INTERNAL SERVER ERROR, message prefixed with "Failed to process
 * message: ".
 */
@Slf4j
@Produces
@Singleton
@Requires(classes = {DispatchException.class, ExceptionHandler.class})
public class DispatchExceptionHandler
    implements ExceptionHandler<DispatchException, HttpResponse<ErrorResponse>> {

  static final String FAILURE_PREFIX = "Failed to process message: ";

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, DispatchException exception) {
    if (exception instanceof InvalidDirectiveException) {
      log.warn("Rejected HTTP message: {}", exception.getMessage());
      return HttpResponse.badRequest(
          new ErrorResponse(exception.getMessage(), HttpStatus.BAD_REQUEST.getCode()));
    }

    log.error("Error processing HTTP message: {}", exception.getMessage());
    return HttpResponse.serverError(
        new ErrorResponse(
            FAILURE_PREFIX + exception.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR.getCode()));
  }
}
