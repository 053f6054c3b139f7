package com.acme.relay.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Puts the current thread id and ingress path in the MDC so the log pattern can tell consumer lines
 * from HTTP request lines.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  static final String THREAD_ID_KEY = "threadId";
  static final String INGRESS_KEY = "ingress";

  private String consumerThreadName = "directive-consumer";

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    Thread current = Thread.currentThread();
    MDC.put(THREAD_ID_KEY, String.valueOf(current.getId()));
    if (consumerThreadName.equals(current.getName())) {
      MDC.put(INGRESS_KEY, "queue");
    } else {
      MDC.remove(INGRESS_KEY);
    }
    return FilterReply.NEUTRAL;
  }

  /** Set from logback.xml. */
  public void setConsumerThreadName(String consumerThreadName) {
    this.consumerThreadName = consumerThreadName;
  }
}
