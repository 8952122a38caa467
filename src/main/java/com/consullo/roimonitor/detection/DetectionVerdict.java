package com.consullo.roimonitor.detection;

import java.time.Instant;

/**
 * Outcome of comparing a candidate frame with the baseline.
 *
 * @param changed true if the candidate differs meaningfully from the baseline
 * @param magnitude strategy-specific difference score, 0 to 100 for the built-in strategies
 * @param strategy strategy that produced the verdict
 * @param comparedAt comparison time
 * @since 1.0
 */
public record DetectionVerdict(
    boolean changed,
    double magnitude,
    DetectionStrategyType strategy,
    Instant comparedAt) {

  public static DetectionVerdict changed(DetectionStrategyType strategy, double magnitude) {
    return new DetectionVerdict(true, magnitude, strategy, Instant.now());
  }

  public static DetectionVerdict unchanged(DetectionStrategyType strategy, double magnitude) {
    return new DetectionVerdict(false, magnitude, strategy, Instant.now());
  }

  /**
   * Builds a verdict from a magnitude and threshold: changed iff magnitude exceeds the threshold.
   *
   * @param strategy strategy
   * @param magnitude magnitude
   * @param threshold threshold
   * @return verdict
   */
  public static DetectionVerdict of(DetectionStrategyType strategy, double magnitude, double threshold) {
    return new DetectionVerdict(magnitude > threshold, magnitude, strategy, Instant.now());
  }
}
