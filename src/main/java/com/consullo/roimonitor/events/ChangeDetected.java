package com.consullo.roimonitor.events;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.detection.DetectionVerdict;
import java.time.Instant;

/**
 * Published when a captured frame differs from the baseline. The frame has already become the new baseline.
 *
 * @param timestamp event time
 * @param sessionId session id
 * @param verdict comparison result
 * @param frame captured frame
 * @param forced true when produced by an out-of-band capture rather than a loop tick
 * @since 1.0
 */
public record ChangeDetected(
    Instant timestamp,
    String sessionId,
    DetectionVerdict verdict,
    Frame frame,
    boolean forced) implements MonitorEvent {
}
