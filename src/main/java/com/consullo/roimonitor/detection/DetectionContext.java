package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active change-detection strategy, the baseline frame and the threshold of one monitoring session.
 *
 * <p>
 * Not thread-safe: the owning monitor guards every call with its session lock.
 * Work that must run outside that lock takes a {@link Snapshot} first and
 * later checks {@link #version()} before committing its result.
 * </p>
 *
 * <p>
 * Switching strategy keeps the baseline unless the caller explicitly asks for a
 * reset. After a reset there is no baseline until the next capture seeds one.
 * </p>
 */
public final class DetectionContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionContext.class);

  private final ChangeDetectionStrategyFactory factory;

  private ChangeDetectionStrategy strategy;
  private Frame baseline;
  private double threshold;

  // Bumped whenever the baseline or strategy is replaced.
  private long version;

  /**
   * Immutable view of the context used to compare a frame without holding the session lock.
   *
   * @param strategy strategy at snapshot time
   * @param baseline baseline at snapshot time, null if none
   * @param threshold threshold at snapshot time
   * @param version context version at snapshot time
   */
  public record Snapshot(ChangeDetectionStrategy strategy, Frame baseline, double threshold, long version) {

    public boolean hasBaseline() {
      return baseline != null;
    }

    /**
     * Compares a candidate with the snapshot's baseline.
     *
     * @param candidate candidate frame
     * @return verdict
     * @throws IllegalStateException if the snapshot has no baseline
     */
    public DetectionVerdict compare(Frame candidate) {
      if (baseline == null) {
        throw new IllegalStateException("No baseline to compare against.");
      }
      return strategy.compare(baseline, candidate, threshold);
    }
  }

  public DetectionContext(ChangeDetectionStrategyFactory factory, DetectionStrategyType type, double threshold) {
    Validate.notNull(factory, "factory must not be null");
    Validate.notNull(type, "type must not be null");
    validateThreshold(threshold);
    this.factory = factory;
    this.strategy = factory.create(type);
    this.threshold = threshold;
  }

  /**
   * Switches the active strategy.
   *
   * @param type new strategy
   * @param resetBaseline true to drop the current baseline so that the next capture becomes the new one
   * @return the previously active strategy type
   */
  public DetectionStrategyType setStrategy(DetectionStrategyType type, boolean resetBaseline) {
    Validate.notNull(type, "type must not be null");
    DetectionStrategyType previous = strategy.type();
    if (previous != type) {
      strategy = factory.create(type);
    }
    if (resetBaseline) {
      baseline = null;
    }
    version++;
    LOGGER.debug("Strategy {} -> {}, baseline reset={}", previous, type, resetBaseline);
    return previous;
  }

  /**
   * Compares a candidate with the current baseline.
   *
   * @param candidate candidate frame
   * @return verdict
   * @throws IllegalStateException if there is no baseline yet
   */
  public DetectionVerdict compare(Frame candidate) {
    Validate.notNull(candidate, "candidate must not be null");
    return snapshot().compare(candidate);
  }

  /**
   * Replaces the baseline. Passing null clears it.
   *
   * @param frame new baseline or null
   */
  public void resetBaseline(Frame frame) {
    baseline = frame;
    version++;
  }

  public Optional<Frame> baseline() {
    return Optional.ofNullable(baseline);
  }

  public boolean hasBaseline() {
    return baseline != null;
  }

  public DetectionStrategyType strategyType() {
    return strategy.type();
  }

  public double threshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    validateThreshold(threshold);
    this.threshold = threshold;
  }

  public long version() {
    return version;
  }

  public Snapshot snapshot() {
    return new Snapshot(strategy, baseline, threshold, version);
  }

  /**
   * Checks a threshold against the range shared by all strategies.
   *
   * @param threshold threshold
   */
  public static void validateThreshold(double threshold) {
    Validate.isTrue(!Double.isNaN(threshold) && threshold >= 0.0 && threshold <= 100.0,
        "threshold must be between 0 and 100, was %s", threshold);
  }
}
