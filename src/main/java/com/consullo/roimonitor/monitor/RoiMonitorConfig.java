package com.consullo.roimonitor.monitor;

/**
 * ROI monitor configuration values.
 *
 * @param maxConsecutiveFailures consecutive tick capture failures that move the session to FAILED
 * @param minimumIntervalMillis smallest accepted poll interval
 * @param changeHistoryCapacity number of most recent changes kept per session
 * @since 1.0
 */
public record RoiMonitorConfig(
    int maxConsecutiveFailures,
    long minimumIntervalMillis,
    int changeHistoryCapacity) {

  public RoiMonitorConfig {
    if (maxConsecutiveFailures < 1) {
      throw new IllegalArgumentException("maxConsecutiveFailures must be at least 1.");
    }
    if (minimumIntervalMillis < 1) {
      throw new IllegalArgumentException("minimumIntervalMillis must be at least 1.");
    }
    if (changeHistoryCapacity < 1) {
      throw new IllegalArgumentException("changeHistoryCapacity must be at least 1.");
    }
  }

  public static RoiMonitorConfig defaults() {
    return new RoiMonitorConfig(5, 10, 100);
  }
}
