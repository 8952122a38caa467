package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.RoiMonitorException;
import java.util.List;

/**
 * Raised when no capture strategy produced a frame. Carries one entry per failed attempt.
 *
 * @since 1.0
 */
public final class CaptureException extends RoiMonitorException {

  private static final long serialVersionUID = 1L;

  /**
   * A single failed attempt.
   *
   * @param strategyName strategy that failed
   * @param message failure description
   * @param cause underlying exception, may be null
   */
  public record StrategyFailure(String strategyName, String message, Throwable cause) {

    @Override
    public String toString() {
      return strategyName + ": " + message;
    }
  }

  private final transient List<StrategyFailure> failures;

  public CaptureException(String message, List<StrategyFailure> failures) {
    super(describe(message, failures));
    this.failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /**
   * Returns the per-strategy failures in attempt order.
   *
   * @return failures
   */
  public List<StrategyFailure> failures() {
    return failures;
  }

  private static String describe(String message, List<StrategyFailure> failures) {
    if (failures == null || failures.isEmpty()) {
      return message;
    }
    StringBuilder sb = new StringBuilder(message);
    sb.append(" [");
    for (int i = 0; i < failures.size(); i++) {
      if (i > 0) {
        sb.append("; ");
      }
      sb.append(failures.get(i));
    }
    sb.append(']');
    return sb.toString();
  }
}
