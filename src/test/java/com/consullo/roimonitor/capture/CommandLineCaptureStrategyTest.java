package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameFixtures;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.process.ProcessConfig;
import com.consullo.roimonitor.process.ProcessResult;
import com.consullo.roimonitor.process.ProcessRunner;
import java.awt.Color;
import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the screenshot-tool strategies with a mocked process runner.
 *
 * @since 1.0
 */
public class CommandLineCaptureStrategyTest {

  private static final Region ROI = new Region(10, 20, 110, 70);

  private final ProcessRunner runner = mock(ProcessRunner.class);

  @Test
  @DisplayName("Should build the region arguments each tool expects")
  void command_PerTool_RegionArguments() {
    assertThat(strategy(CommandLineCaptureStrategy.Tool.GRIM).command(ROI))
            .containsExactly("grim", "-g", "10,20 100x50", "-");
    assertThat(strategy(CommandLineCaptureStrategy.Tool.SCROT).command(ROI))
            .containsExactly("scrot", "-a", "10,20,100,50", "-z", "-");
    assertThat(strategy(CommandLineCaptureStrategy.Tool.IMPORT).command(ROI))
            .containsExactly("import", "-window", "root", "-crop", "100x50+10+20", "png:-");
    assertThat(strategy(CommandLineCaptureStrategy.Tool.GRIM).command(null))
            .containsExactly("grim", "-");
  }

  @Test
  @DisplayName("Should decode the tool's PNG output into a frame")
  void capture_PngOnStdout_ReturnsFrame() throws Exception {
    final byte[] png = FrameFixtures.solid(100, 50, Color.ORANGE).toByteArray();
    when(runner.run(any())).thenReturn(new ProcessResult(0, png, ""));

    final Frame frame = strategy(CommandLineCaptureStrategy.Tool.SCROT).capture(ROI);

    assertThat(frame.getStrategyName()).isEqualTo("scrot");
    assertThat(frame.getWidth()).isEqualTo(100);
    assertThat(frame.getRegion()).isEqualTo(ROI);
    final ArgumentCaptor<ProcessConfig> config = ArgumentCaptor.forClass(ProcessConfig.class);
    verify(runner).run(config.capture());
    assertThat(config.getValue().timeout()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Should fail on a non-zero exit or empty output")
  void capture_ToolFailure_Throws() throws Exception {
    final CommandLineCaptureStrategy grim = strategy(CommandLineCaptureStrategy.Tool.GRIM);
    when(runner.run(any()))
            .thenReturn(new ProcessResult(1, new byte[0], "compositor doesn't support wlr-screencopy"))
            .thenReturn(new ProcessResult(0, new byte[0], ""));

    assertThatThrownBy(() -> grim.capture(ROI))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("wlr-screencopy");
    assertThatThrownBy(() -> grim.capture(ROI))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no output");
  }

  @Test
  @DisplayName("Should require the matching display server and the tool on the path, and never run in WSL")
  void isSupported_DisplayServerAndTool() {
    final PlatformCapabilities wayland =
            new PlatformCapabilities("Linux", false, false, true, false, false, Set.of("grim", "scrot"), null);
    final PlatformCapabilities x11NoTools =
            new PlatformCapabilities("Linux", false, false, false, true, false, Set.of(), null);
    final PlatformCapabilities wsl =
            new PlatformCapabilities("Linux", false, true, true, true, false, Set.of("grim", "scrot"), null);

    assertThat(strategy(CommandLineCaptureStrategy.Tool.GRIM).isSupported(wayland)).isTrue();
    assertThat(strategy(CommandLineCaptureStrategy.Tool.SCROT).isSupported(wayland)).isFalse();
    assertThat(strategy(CommandLineCaptureStrategy.Tool.SCROT).isSupported(x11NoTools)).isFalse();
    assertThat(strategy(CommandLineCaptureStrategy.Tool.GRIM).isSupported(wsl)).isFalse();
  }

  private CommandLineCaptureStrategy strategy(final CommandLineCaptureStrategy.Tool tool) {
    return new CommandLineCaptureStrategy(tool, runner, Duration.ofSeconds(5));
  }
}
