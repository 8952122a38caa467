package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.process.ProcessRunner;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Default strategy priority per platform.
 *
 * @since 1.0
 */
public final class CaptureStrategies {

  private CaptureStrategies() {
  }

  /**
   * Returns the candidate strategies for a platform, highest priority first. Candidates are not filtered;
   * {@link CaptureChain} drops the unsupported ones.
   *
   * @param caps platform capabilities
   * @param runner runner for external tools
   * @param toolTimeout bound on a single external tool run
   * @return ordered candidates
   */
  public static List<CaptureStrategy> defaultsFor(
          final PlatformCapabilities caps, final ProcessRunner runner, final Duration toolTimeout) {
    final List<CaptureStrategy> list = new ArrayList<>();
    if (caps.wsl()) {
      list.add(PowerShellCaptureStrategy.forWsl(runner, toolTimeout));
      list.add(new RobotCaptureStrategy());
    } else if (caps.windows()) {
      list.add(new RobotCaptureStrategy());
      list.add(PowerShellCaptureStrategy.forWindows(runner, toolTimeout));
    } else if (caps.wayland()) {
      list.add(new CommandLineCaptureStrategy(CommandLineCaptureStrategy.Tool.GRIM, runner, toolTimeout));
      list.add(new RobotCaptureStrategy());
    } else if (caps.x11()) {
      list.add(new RobotCaptureStrategy());
      list.add(new CommandLineCaptureStrategy(CommandLineCaptureStrategy.Tool.SCROT, runner, toolTimeout));
      list.add(new CommandLineCaptureStrategy(CommandLineCaptureStrategy.Tool.IMPORT, runner, toolTimeout));
    } else {
      list.add(new RobotCaptureStrategy());
    }
    return list;
  }
}
