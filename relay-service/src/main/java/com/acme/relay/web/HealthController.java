package com.acme.relay.web;

import com.acme.relay.consumer.QueueConsumer;
import com.acme.relay.lifecycle.InFlightRequests;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller
public class HealthController {

  private final QueueConsumer consumer;
  private final InFlightRequests inFlight;

  public HealthController(QueueConsumer consumer, InFlightRequests inFlight) {
    this.consumer = consumer;
    this.inFlight = inFlight;
  }

  @Get("/health")
  public HttpResponse<Map<String, String>> health() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", inFlight.isDraining() ? "DRAINING" : "UP");
    body.put("consumer", consumer.isRunning() ? "RUNNING" : "STOPPED");
    return HttpResponse.ok(body);
  }
}
