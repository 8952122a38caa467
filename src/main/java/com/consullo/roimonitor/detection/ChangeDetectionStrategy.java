package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;

/**
 * Decides whether a candidate frame differs meaningfully from a baseline frame.
 *
 * <p>Implementations hold no per-session state and may be shared between the monitor loop and
 * out-of-band captures.
 *
 * @since 1.0
 */
public interface ChangeDetectionStrategy {

  /**
   * Returns the algorithm this strategy implements.
   *
   * @return strategy type
   */
  DetectionStrategyType type();

  /**
   * Compares two frames.
   *
   * <p>Identical frames must never be reported as changed, whatever the (non-negative) threshold.
   *
   * @param baseline current baseline frame
   * @param candidate freshly captured frame
   * @param threshold sensitivity threshold; meaning is strategy-specific
   * @return verdict
   */
  DetectionVerdict compare(final Frame baseline, final Frame candidate, final double threshold);
}
