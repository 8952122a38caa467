package com.consullo.roimonitor.monitor;

import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.detection.DetectionStrategyType;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the monitor, as returned by {@link RoiMonitor#getStatus()}.
 *
 * @param sessionId current or last session id, null while idle
 * @param state lifecycle state
 * @param region monitored region, null while idle
 * @param strategy active detection strategy, null while idle
 * @param threshold active threshold
 * @param intervalMillis poll interval
 * @param consecutiveFailures current run of tick capture failures
 * @param statistics copy of the session counters, null while idle
 * @param capturedAt time this status was taken
 * @since 1.0
 */
public record MonitorStatus(
    String sessionId,
    MonitorState state,
    Region region,
    DetectionStrategyType strategy,
    double threshold,
    long intervalMillis,
    int consecutiveFailures,
    MonitoringStatistics statistics,
    Instant capturedAt) {

  static MonitorStatus idle(Instant now) {
    return new MonitorStatus(null, MonitorState.IDLE, null, null, 0.0, 0L, 0, null, now);
  }

  public long ticks() {
    return statistics == null ? 0L : statistics.getTicks();
  }

  public long changesDetected() {
    return statistics == null ? 0L : statistics.getChangesDetected();
  }

  public Instant startedAt() {
    return statistics == null ? null : statistics.getStartedAt();
  }

  public Duration uptime() {
    return statistics == null ? Duration.ZERO : statistics.getUptime(capturedAt);
  }
}
