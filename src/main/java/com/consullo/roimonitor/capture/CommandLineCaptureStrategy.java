package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameCodec;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.process.ProcessConfig;
import com.consullo.roimonitor.process.ProcessResult;
import com.consullo.roimonitor.process.ProcessRunner;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures by running a Linux screenshot tool that writes PNG to standard output.
 *
 * @since 1.0
 */
public final class CommandLineCaptureStrategy implements CaptureStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineCaptureStrategy.class);

  /**
   * Supported screenshot tools.
   */
  public enum Tool {
    /** Wayland (wlroots compositors). */
    GRIM("grim", "grim") {
      @Override
      boolean runsOn(final PlatformCapabilities caps) {
        return caps.wayland();
      }

      @Override
      List<String> arguments(final Region region) {
        final List<String> args = new ArrayList<>();
        if (region != null) {
          args.add("-g");
          args.add(region.left() + "," + region.top() + " " + region.width() + "x" + region.height());
        }
        args.add("-");
        return args;
      }
    },
    /** X11. */
    SCROT("scrot", "scrot") {
      @Override
      boolean runsOn(final PlatformCapabilities caps) {
        return caps.x11();
      }

      @Override
      List<String> arguments(final Region region) {
        final List<String> args = new ArrayList<>();
        if (region != null) {
          args.add("-a");
          args.add(region.left() + "," + region.top() + "," + region.width() + "," + region.height());
        }
        args.add("-z");
        args.add("-");
        return args;
      }
    },
    /** X11, ImageMagick. */
    IMPORT("import", "import") {
      @Override
      boolean runsOn(final PlatformCapabilities caps) {
        return caps.x11();
      }

      @Override
      List<String> arguments(final Region region) {
        final List<String> args = new ArrayList<>();
        args.add("-window");
        args.add("root");
        if (region != null) {
          args.add("-crop");
          args.add(region.width() + "x" + region.height() + "+" + region.left() + "+" + region.top());
        }
        args.add("png:-");
        return args;
      }
    };

    private final String strategyName;
    private final String executable;

    Tool(final String strategyName, final String executable) {
      this.strategyName = strategyName;
      this.executable = executable;
    }

    public String strategyName() {
      return strategyName;
    }

    public String executable() {
      return executable;
    }

    abstract boolean runsOn(PlatformCapabilities caps);

    abstract List<String> arguments(Region region);
  }

  private final Tool tool;
  private final ProcessRunner runner;
  private final Duration timeout;

  /**
   * Creates a strategy.
   *
   * @param tool screenshot tool
   * @param runner process runner
   * @param timeout bound on a single tool run
   */
  public CommandLineCaptureStrategy(final Tool tool, final ProcessRunner runner, final Duration timeout) {
    Validate.notNull(tool, "tool must not be null");
    Validate.notNull(runner, "runner must not be null");
    Validate.notNull(timeout, "timeout must not be null");
    this.tool = tool;
    this.runner = runner;
    this.timeout = timeout;
  }

  public Tool tool() {
    return tool;
  }

  @Override
  public String name() {
    return tool.strategyName();
  }

  @Override
  public boolean isSupported(final PlatformCapabilities capabilities) {
    return !capabilities.wsl()
            && !capabilities.windows()
            && tool.runsOn(capabilities)
            && capabilities.hasTool(tool.executable());
  }

  @Override
  public boolean supportsRegion() {
    return true;
  }

  /**
   * Builds the full command line for a capture.
   *
   * @param region region, or null for the full display
   * @return command and arguments
   */
  List<String> command(final Region region) {
    final List<String> command = new ArrayList<>();
    command.add(tool.executable());
    command.addAll(tool.arguments(region));
    return command;
  }

  @Override
  public Frame capture(final Region region) throws Exception {
    final List<String> command = command(region);
    final ProcessResult result = runner.run(new ProcessConfig(command, null, null, timeout));
    if (!result.isSuccess()) {
      throw new IOException(tool.executable() + " exited with " + result.exitCode()
              + (result.stderr().isEmpty() ? "" : ": " + result.stderr()));
    }
    if (result.stdout() == null || result.stdout().length == 0) {
      throw new IOException(tool.executable() + " produced no output");
    }
    LOGGER.debug("{} captured {} bytes", tool.executable(), result.stdout().length);
    return FrameCodec.fromPayload(result.stdout(), name(), region);
  }
}
