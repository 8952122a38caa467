package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.process.ProcessRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for platform detection from synthetic environments, and the default strategy order.
 *
 * @since 1.0
 */
public class PlatformDetectorTest {

  @TempDir
  Path tempDir;

  private final ProcessRunner runner = mock(ProcessRunner.class);

  @Test
  @DisplayName("Should detect WSL from the kernel version string")
  void detect_MicrosoftKernel_Wsl() throws Exception {
    final Path procVersion = tempDir.resolve("version");
    Files.writeString(procVersion, "Linux version 5.15.153.1-microsoft-standard-WSL2 (root@1c602f52c2e4)");
    when(runner.isOnPath("powershell.exe")).thenReturn(true);

    final PlatformCapabilities caps =
            new PlatformDetector(Map.of("DISPLAY", ":0"), "Linux", procVersion, runner, true).detect();

    assertThat(caps.wsl()).isTrue();
    assertThat(caps.x11()).isFalse();
    assertThat(caps.windows()).isFalse();
    assertThat(caps.hasTool("powershell.exe")).isTrue();
    assertThat(caps.virtualDisplay()).isNull();
  }

  @Test
  @DisplayName("Should detect Wayland and X11 from the environment and probe tools on the path")
  void detect_WaylandSession_ToolsProbed() throws Exception {
    final Path procVersion = tempDir.resolve("version");
    Files.writeString(procVersion, "Linux version 6.8.0-45-generic (buildd@lcy02-amd64-075)");
    when(runner.isOnPath(anyString())).thenReturn(false);
    when(runner.isOnPath("grim")).thenReturn(true);

    final PlatformCapabilities caps = new PlatformDetector(
            Map.of("WAYLAND_DISPLAY", "wayland-0", "DISPLAY", ":1"), "Linux", procVersion, runner, true).detect();

    assertThat(caps.wsl()).isFalse();
    assertThat(caps.wayland()).isTrue();
    assertThat(caps.x11()).isTrue();
    assertThat(caps.availableTools()).containsExactly("grim");
    assertThat(caps.headless()).isTrue();
  }

  @Test
  @DisplayName("Should treat a WSL_DISTRO_NAME variable as WSL even without /proc/version")
  void detect_WslEnvironmentVariable_Wsl() {
    final PlatformCapabilities caps = new PlatformDetector(
            Map.of("WSL_DISTRO_NAME", "Ubuntu"), "Linux", tempDir.resolve("missing"), runner, true).detect();

    assertThat(caps.wsl()).isTrue();
  }

  @Test
  @DisplayName("Should detect native Windows from os.name")
  void detect_Windows() {
    final PlatformCapabilities caps = new PlatformDetector(Map.of(), "Windows 11", null, runner, true).detect();

    assertThat(caps.windows()).isTrue();
    assertThat(caps.wsl()).isFalse();
    assertThat(caps.operatingSystem()).isEqualTo("Windows 11");
  }

  @Test
  @DisplayName("Default priority order depends on the platform")
  void defaultsFor_PerPlatform() {
    assertThat(names(new PlatformCapabilities("Linux", false, true, false, false, false, null, null)))
            .containsExactly("wsl_powershell", "awt_robot");
    assertThat(names(new PlatformCapabilities("Windows 10", true, false, false, false, false, null, null)))
            .containsExactly("awt_robot", "windows_powershell");
    assertThat(names(new PlatformCapabilities("Linux", false, false, true, false, false, null, null)))
            .containsExactly("grim", "awt_robot");
    assertThat(names(new PlatformCapabilities("Linux", false, false, false, true, false, null, null)))
            .containsExactly("awt_robot", "scrot", "import");
    assertThat(names(new PlatformCapabilities("Mac OS X", false, false, false, false, false, null, null)))
            .containsExactly("awt_robot");
  }

  @Test
  @DisplayName("The AWT robot is unusable when headless or inside WSL")
  void robot_IsSupported() {
    final RobotCaptureStrategy robot = new RobotCaptureStrategy();

    assertThat(robot.isSupported(new PlatformCapabilities("Linux", false, false, false, true, true, null, null)))
            .isFalse();
    assertThat(robot.isSupported(new PlatformCapabilities("Linux", false, true, false, false, false, null, null)))
            .isFalse();
    assertThat(robot.isSupported(new PlatformCapabilities("Linux", false, false, false, true, false, null, null)))
            .isTrue();
  }

  private List<String> names(final PlatformCapabilities caps) {
    return CaptureStrategies.defaultsFor(caps, runner, Duration.ofSeconds(1)).stream()
            .map(CaptureStrategy::name)
            .toList();
  }
}
