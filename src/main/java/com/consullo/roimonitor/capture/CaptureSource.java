package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.InvalidRegionException;
import com.consullo.roimonitor.core.Region;

/**
 * Source of frames used by the monitor. The production implementation is {@link CaptureChain}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CaptureSource {

  /**
   * Captures the full virtual display or a region of it.
   *
   * @param region region to capture, or null for the full display
   * @return captured frame
   * @throws CaptureException if no frame could be obtained
   * @throws InvalidRegionException if the region cannot be captured at the current display bounds
   */
  Frame capture(Region region) throws CaptureException, InvalidRegionException;
}
