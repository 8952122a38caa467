package com.consullo.roimonitor.events;

import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.detection.DetectionStrategyType;
import java.time.Instant;

/**
 * Published once a session has seeded its baseline and its loop is about to tick.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param region monitored region
 * @param strategy active change-detection strategy
 * @param threshold detection threshold
 * @param intervalMillis poll interval
 * @since 1.0
 */
public record MonitoringStarted(
    Instant timestamp,
    String sessionId,
    Region region,
    DetectionStrategyType strategy,
    double threshold,
    long intervalMillis) implements MonitorEvent {
}
