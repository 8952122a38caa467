package com.consullo.roimonitor.events;

import com.consullo.roimonitor.core.RoiMonitorException;
import java.time.Instant;

/**
 * Published whenever a capture attempt fails.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param error failure, usually a {@code CaptureException} aggregating every strategy's error
 * @param consecutiveFailures consecutive loop failures including this one; 0 for out-of-band captures
 * @since 1.0
 */
public record CaptureFailed(
    Instant timestamp,
    String sessionId,
    RoiMonitorException error,
    int consecutiveFailures) implements MonitorEvent {
}
