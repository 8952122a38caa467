package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameCodec;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import java.awt.AWTException;
import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures through {@link Robot#createScreenCapture(Rectangle)}.
 *
 * <p>Works on native Windows, macOS and X11 sessions. Not used in WSL, where the JVM has no access to the
 * Windows desktop, nor when AWT runs headless.
 *
 * @since 1.0
 */
public final class RobotCaptureStrategy implements CaptureStrategy {

  public static final String NAME = "awt_robot";

  private static final Logger LOGGER = LoggerFactory.getLogger(RobotCaptureStrategy.class);

  private final Object robotLock = new Object();
  private Robot robot;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isSupported(final PlatformCapabilities capabilities) {
    return !capabilities.headless() && !capabilities.wsl();
  }

  @Override
  public boolean supportsRegion() {
    return true;
  }

  @Override
  public Frame capture(final Region region) throws Exception {
    final Rectangle bounds = region != null ? region.toRectangle() : fullDisplayBounds();
    final BufferedImage image = robot().createScreenCapture(bounds);
    return FrameCodec.encode(image, NAME, Region.fromRectangle(bounds));
  }

  /**
   * Union of all screen device bounds.
   *
   * @return bounds of the virtual display
   */
  static Rectangle fullDisplayBounds() {
    Rectangle union = null;
    for (final GraphicsDevice device : GraphicsEnvironment.getLocalGraphicsEnvironment().getScreenDevices()) {
      final Rectangle b = device.getDefaultConfiguration().getBounds();
      union = union == null ? new Rectangle(b) : union.union(b);
    }
    if (union == null) {
      throw new IllegalStateException("No screen devices available");
    }
    return union;
  }

  private Robot robot() throws AWTException {
    synchronized (robotLock) {
      if (robot == null) {
        robot = new Robot();
        LOGGER.debug("AWT robot created");
      }
      return robot;
    }
  }
}
