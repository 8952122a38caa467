package com.consullo.roimonitor.capture;

import java.time.Duration;

/**
 * Capture chain configuration values.
 *
 * @param attemptTimeout upper bound on a single strategy attempt
 * @param preferredAttempts attempts on the memoized strategy before the full ordered scan runs
 * @since 1.0
 */
public record CaptureChainConfig(
    Duration attemptTimeout,
    int preferredAttempts) {

  public CaptureChainConfig {
    if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
      throw new IllegalArgumentException("attemptTimeout must be positive.");
    }
    if (preferredAttempts < 1) {
      throw new IllegalArgumentException("preferredAttempts must be at least 1.");
    }
  }

  public static CaptureChainConfig defaults() {
    return new CaptureChainConfig(Duration.ofSeconds(10), 2);
  }
}
