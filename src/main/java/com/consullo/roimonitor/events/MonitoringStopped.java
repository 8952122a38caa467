package com.consullo.roimonitor.events;

import java.time.Instant;

/**
 * Published when a session stops, either on request or after too many consecutive capture failures.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param reason stop reason, {@link #CAPTURE_FAILURES_EXCEEDED} for the fatal path
 * @param failed true when the session ended in the failed state
 * @since 1.0
 */
public record MonitoringStopped(
    Instant timestamp,
    String sessionId,
    String reason,
    boolean failed) implements MonitorEvent {

  public static final String CAPTURE_FAILURES_EXCEEDED = "capture_failures_exceeded";
}
