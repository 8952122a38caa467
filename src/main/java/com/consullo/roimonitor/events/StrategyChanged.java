package com.consullo.roimonitor.events;

import com.consullo.roimonitor.detection.DetectionStrategyType;
import java.time.Instant;

/**
 * Published when the change-detection strategy of a running or paused session is switched.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param previous previous strategy
 * @param current new strategy
 * @param baselineReset true if the baseline was dropped
 * @since 1.0
 */
public record StrategyChanged(
    Instant timestamp,
    String sessionId,
    DetectionStrategyType previous,
    DetectionStrategyType current,
    boolean baselineReset) implements MonitorEvent {
}
