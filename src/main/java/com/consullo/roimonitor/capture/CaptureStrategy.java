package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;

/**
 * One concrete way of obtaining a screen image on one platform.
 *
 * <p>Implementations must:
 * - report whether they can run given the detected platform capabilities
 * - return a fully decodable frame or throw; a strategy never returns an empty payload
 * - respond to thread interruption where the underlying call allows it
 *
 * @since 1.0
 */
public interface CaptureStrategy {

  /**
   * Stable name used in logs, frames and error reports (e.g. "awt_robot").
   *
   * @return name
   */
  String name();

  /**
   * Returns true if this strategy can run in the described environment.
   *
   * @param capabilities detected capabilities
   * @return true if usable
   */
  boolean isSupported(final PlatformCapabilities capabilities);

  /**
   * Returns true if {@link #capture(Region)} honours a non-null region. Strategies returning false are asked
   * for the full display and the result is cropped by the caller.
   *
   * @return true if sub-rectangle capture is native
   */
  boolean supportsRegion();

  /**
   * Captures the full virtual display, or the given region.
   *
   * @param region region in display coordinates, or null for the full display
   * @return captured frame
   * @throws Exception if capture fails
   */
  Frame capture(final Region region) throws Exception;
}
