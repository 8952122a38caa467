package com.consullo.roimonitor.monitor;

import com.consullo.roimonitor.detection.DetectionVerdict;
import java.time.Instant;

/**
 * One committed change in a session's change history.
 *
 * @param detectedAt when the change was committed
 * @param verdict verdict that reported the change
 * @param forced true if the change came from a forced capture
 * @since 1.0
 */
public record ChangeRecord(Instant detectedAt, DetectionVerdict verdict, boolean forced) {
}
