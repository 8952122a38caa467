package com.consullo.roimonitor.events;

import com.consullo.roimonitor.core.Region;
import java.time.Instant;

/**
 * Published when the monitored region of a session is replaced. The baseline is reset at the same time.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param previous previous region
 * @param current new region
 * @since 1.0
 */
public record RegionUpdated(
    Instant timestamp,
    String sessionId,
    Region previous,
    Region current) implements MonitorEvent {
}
