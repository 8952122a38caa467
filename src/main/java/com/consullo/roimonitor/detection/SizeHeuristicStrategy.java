package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;
import org.apache.commons.lang3.Validate;

/**
 * Compares the encoded payload sizes of two frames.
 *
 * <p>
 * Magnitude is the size difference as a percentage of the baseline size. This
 * is the cheapest check available: it needs no decoding. It misses content
 * changes that happen to encode to the same size, and it may fire on encoder
 * noise when nothing visible changed. Both are accepted tradeoffs for its cost.
 * </p>
 */
public final class SizeHeuristicStrategy implements ChangeDetectionStrategy {

  @Override
  public DetectionStrategyType type() {
    return DetectionStrategyType.SIZE;
  }

  @Override
  public DetectionVerdict compare(Frame baseline, Frame candidate, double threshold) {
    Validate.notNull(baseline, "baseline must not be null");
    Validate.notNull(candidate, "candidate must not be null");

    long baselineSize = baseline.size();
    long delta = Math.abs((long) candidate.size() - baselineSize);
    double magnitude = (double) delta / Math.max(1L, baselineSize) * 100.0;
    return DetectionVerdict.of(type(), magnitude, threshold);
  }
}
