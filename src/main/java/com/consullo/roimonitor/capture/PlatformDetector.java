package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.process.ProcessRunner;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link PlatformCapabilities} description from explicit inputs.
 *
 * <p>All environment access goes through constructor arguments so detection can be exercised with
 * synthetic environments.
 *
 * @since 1.0
 */
public final class PlatformDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlatformDetector.class);

  /** Executables probed on the search path. */
  public static final List<String> PROBED_TOOLS = List.of("grim", "scrot", "import", "powershell.exe");

  private final Map<String, String> environment;
  private final String osName;
  private final Path procVersion;
  private final ProcessRunner runner;
  private final boolean headless;

  /**
   * Creates a detector.
   *
   * @param environment environment variables
   * @param osName value of {@code os.name}
   * @param procVersion kernel version file consulted for WSL detection
   * @param runner runner used for search path lookups
   * @param headless true when AWT is headless
   */
  public PlatformDetector(
          final Map<String, String> environment,
          final String osName,
          final Path procVersion,
          final ProcessRunner runner,
          final boolean headless) {
    Validate.notNull(environment, "environment must not be null");
    Validate.notNull(osName, "osName must not be null");
    Validate.notNull(runner, "runner must not be null");
    this.environment = Map.copyOf(environment);
    this.osName = osName;
    this.procVersion = procVersion;
    this.runner = runner;
    this.headless = headless;
  }

  /**
   * Detector for the running JVM.
   *
   * @param runner runner used for search path lookups
   * @return detector
   */
  public static PlatformDetector forCurrentProcess(final ProcessRunner runner) {
    return new PlatformDetector(
            System.getenv(),
            System.getProperty("os.name", ""),
            Path.of("/proc/version"),
            runner,
            GraphicsEnvironment.isHeadless());
  }

  /**
   * Runs detection.
   *
   * @return capabilities
   */
  public PlatformCapabilities detect() {
    final String os = osName.toLowerCase(Locale.ROOT);
    final boolean windows = os.startsWith("windows");
    final boolean linux = os.contains("linux");
    final boolean wsl = linux && isWsl();
    final boolean wayland = linux && !wsl && StringUtils.isNotBlank(environment.get("WAYLAND_DISPLAY"));
    final boolean x11 = linux && !wsl && StringUtils.isNotBlank(environment.get("DISPLAY"));

    final Set<String> tools = new LinkedHashSet<>();
    for (final String tool : PROBED_TOOLS) {
      if (runner.isOnPath(tool)) {
        tools.add(tool);
      }
    }

    final Region display = headless ? null : localVirtualDisplay();
    final PlatformCapabilities caps =
            new PlatformCapabilities(osName, windows, wsl, wayland, x11, headless, tools, display);
    LOGGER.info("Platform: os={}, windows={}, wsl={}, wayland={}, x11={}, headless={}, tools={}, display={}",
            osName, windows, wsl, wayland, x11, headless, tools, display);
    return caps;
  }

  private boolean isWsl() {
    if (StringUtils.isNotBlank(environment.get("WSL_DISTRO_NAME"))
            || StringUtils.isNotBlank(environment.get("WSL_INTEROP"))) {
      return true;
    }
    if (procVersion == null || !Files.isReadable(procVersion)) {
      return false;
    }
    try {
      final String version = Files.readString(procVersion, StandardCharsets.UTF_8);
      return version.toLowerCase(Locale.ROOT).contains("microsoft");
    } catch (final IOException e) {
      LOGGER.debug("Cannot read {}: {}", procVersion, e.getMessage());
      return false;
    }
  }

  private static Region localVirtualDisplay() {
    try {
      return Region.fromRectangle(RobotCaptureStrategy.fullDisplayBounds());
    } catch (final HeadlessException | IllegalStateException e) {
      LOGGER.debug("Virtual display bounds unavailable: {}", e.getMessage());
      return null;
    }
  }
}
