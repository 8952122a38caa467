package com.consullo.roimonitor.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Cumulative counters for one monitoring session.
 *
 * <p>Mutated only by {@link RoiMonitor} under its session lock. Callers receive copies through
 * {@link MonitorStatus}.
 *
 * @since 1.0
 */
public final class MonitoringStatistics {

  private final Instant startedAt;

  private long ticks;
  private long framesCaptured;
  private long changesDetected;
  private long totalFailures;
  private double magnitudeSum;
  private double minimumMagnitude;
  private double maximumMagnitude;
  private Instant lastChangeAt;
  private Instant endedAt;

  MonitoringStatistics(Instant startedAt) {
    this.startedAt = startedAt;
  }

  private MonitoringStatistics(MonitoringStatistics other) {
    this.startedAt = other.startedAt;
    this.ticks = other.ticks;
    this.framesCaptured = other.framesCaptured;
    this.changesDetected = other.changesDetected;
    this.totalFailures = other.totalFailures;
    this.magnitudeSum = other.magnitudeSum;
    this.minimumMagnitude = other.minimumMagnitude;
    this.maximumMagnitude = other.maximumMagnitude;
    this.lastChangeAt = other.lastChangeAt;
    this.endedAt = other.endedAt;
  }

  void recordTick() {
    ticks++;
  }

  void recordFrame() {
    framesCaptured++;
  }

  void recordFailure() {
    totalFailures++;
  }

  void recordChange(double magnitude, Instant at) {
    if (changesDetected == 0) {
      minimumMagnitude = magnitude;
      maximumMagnitude = magnitude;
    } else {
      minimumMagnitude = Math.min(minimumMagnitude, magnitude);
      maximumMagnitude = Math.max(maximumMagnitude, magnitude);
    }
    changesDetected++;
    magnitudeSum += magnitude;
    lastChangeAt = at;
  }

  void recordEnd(Instant at) {
    if (endedAt == null) {
      endedAt = at;
    }
  }

  MonitoringStatistics copy() {
    return new MonitoringStatistics(this);
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  /**
   * Loop iterations that attempted a capture, successful or not.
   *
   * @return ticks
   */
  public long getTicks() {
    return ticks;
  }

  /**
   * Successful captures, including the initial and forced ones.
   *
   * @return frames
   */
  public long getFramesCaptured() {
    return framesCaptured;
  }

  public long getChangesDetected() {
    return changesDetected;
  }

  public long getTotalFailures() {
    return totalFailures;
  }

  /**
   * Mean magnitude of detected changes, 0 before the first change.
   *
   * @return average magnitude
   */
  public double getAverageMagnitude() {
    return changesDetected == 0 ? 0.0 : magnitudeSum / changesDetected;
  }

  public double getMinimumMagnitude() {
    return minimumMagnitude;
  }

  public double getMaximumMagnitude() {
    return maximumMagnitude;
  }

  /**
   * Time of the last detected change, null before the first one.
   *
   * @return timestamp or null
   */
  public Instant getLastChangeAt() {
    return lastChangeAt;
  }

  /**
   * Time the session stopped or failed, null while it is still active.
   *
   * @return timestamp or null
   */
  public Instant getEndedAt() {
    return endedAt;
  }

  /**
   * Time elapsed between the session start and {@code now}, or its end if it has ended.
   *
   * @param now reference time
   * @return uptime, zero if not started
   */
  public Duration getUptime(Instant now) {
    Instant end = endedAt != null ? endedAt : now;
    if (startedAt == null || end.isBefore(startedAt)) {
      return Duration.ZERO;
    }
    return Duration.between(startedAt, end);
  }

  @Override
  public String toString() {
    return "MonitoringStatistics{ticks=" + ticks
        + ", frames=" + framesCaptured
        + ", changes=" + changesDetected
        + ", failures=" + totalFailures
        + ", avgMagnitude=" + String.format(Locale.ROOT, "%.2f", getAverageMagnitude())
        + "}";
  }
}
