package com.consullo.roimonitor.core;

/**
 * Raised when a region violates the monitoring-area invariants, either as supplied by a caller or after it has
 * been clamped to the virtual display.
 *
 * @since 1.0
 */
public final class InvalidRegionException extends RoiMonitorException {

  private static final long serialVersionUID = 1L;

  private final transient Region region;

  public InvalidRegionException(Region region, String message) {
    super(message);
    this.region = region;
  }

  /**
   * Returns the offending region.
   *
   * @return region, may be null when the caller supplied none
   */
  public Region region() {
    return region;
  }
}
