package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameCodec;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.process.ProcessConfig;
import com.consullo.roimonitor.process.ProcessResult;
import com.consullo.roimonitor.process.ProcessRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures the Windows desktop through a PowerShell script that prints the image as base64 PNG.
 *
 * <p>Two flavours exist: one for native Windows, and one that reaches the Windows host from inside WSL
 * through {@code powershell.exe} interop.
 *
 * @since 1.0
 */
public final class PowerShellCaptureStrategy implements CaptureStrategy {

  public static final String WINDOWS_NAME = "windows_powershell";
  public static final String WSL_NAME = "wsl_powershell";

  private static final Logger LOGGER = LoggerFactory.getLogger(PowerShellCaptureStrategy.class);

  private static final String SCRIPT_PREFIX = String.join("\n",
          "Add-Type -AssemblyName System.Windows.Forms",
          "Add-Type -AssemblyName System.Drawing",
          "try {");

  private static final String SCRIPT_SUFFIX = String.join("\n",
          "  $bitmap = New-Object System.Drawing.Bitmap $w, $h",
          "  $graphic = [System.Drawing.Graphics]::FromImage($bitmap)",
          "  $graphic.CopyFromScreen($x, $y, 0, 0, $bitmap.Size)",
          "  $ms = New-Object System.IO.MemoryStream",
          "  $bitmap.Save($ms, [System.Drawing.Imaging.ImageFormat]::Png)",
          "  Write-Output ([Convert]::ToBase64String($ms.ToArray()))",
          "} catch {",
          "  Write-Error $_.Exception.Message",
          "  exit 1",
          "} finally {",
          "  if ($graphic) { $graphic.Dispose() }",
          "  if ($bitmap) { $bitmap.Dispose() }",
          "  if ($ms) { $ms.Dispose() }",
          "}");

  private final String name;
  private final boolean forWsl;
  private final String executable;
  private final ProcessRunner runner;
  private final Duration timeout;

  private PowerShellCaptureStrategy(
          final String name,
          final boolean forWsl,
          final String executable,
          final ProcessRunner runner,
          final Duration timeout) {
    Validate.notNull(runner, "runner must not be null");
    Validate.notNull(timeout, "timeout must not be null");
    this.name = name;
    this.forWsl = forWsl;
    this.executable = executable;
    this.runner = runner;
    this.timeout = timeout;
  }

  /**
   * Strategy for native Windows.
   *
   * @param runner process runner
   * @param timeout bound on a single script run
   * @return strategy
   */
  public static PowerShellCaptureStrategy forWindows(final ProcessRunner runner, final Duration timeout) {
    return new PowerShellCaptureStrategy(WINDOWS_NAME, false, "powershell.exe", runner, timeout);
  }

  /**
   * Strategy for WSL, calling the Windows host's PowerShell.
   *
   * @param runner process runner
   * @param timeout bound on a single script run
   * @return strategy
   */
  public static PowerShellCaptureStrategy forWsl(final ProcessRunner runner, final Duration timeout) {
    return new PowerShellCaptureStrategy(WSL_NAME, true, "powershell.exe", runner, timeout);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isSupported(final PlatformCapabilities capabilities) {
    if (forWsl) {
      return capabilities.wsl() && capabilities.hasTool(executable);
    }
    return capabilities.windows();
  }

  @Override
  public boolean supportsRegion() {
    return true;
  }

  /**
   * Builds the capture script.
   *
   * @param region region, or null for the whole virtual screen
   * @return script text
   */
  static String script(final Region region) {
    final String bounds;
    if (region == null) {
      bounds = String.join("\n",
              "  $vs = [System.Windows.Forms.SystemInformation]::VirtualScreen",
              "  $x = $vs.Left; $y = $vs.Top; $w = $vs.Width; $h = $vs.Height");
    } else {
      bounds = "  $x = " + region.left() + "; $y = " + region.top()
              + "; $w = " + region.width() + "; $h = " + region.height();
    }
    return SCRIPT_PREFIX + "\n" + bounds + "\n" + SCRIPT_SUFFIX;
  }

  @Override
  public Frame capture(final Region region) throws Exception {
    final List<String> command = List.of(executable, "-NoProfile", "-NonInteractive", "-Command", script(region));
    final ProcessResult result = runner.run(new ProcessConfig(command, null, null, timeout));
    if (!result.isSuccess()) {
      throw new IOException("PowerShell exited with " + result.exitCode()
              + (result.stderr().isEmpty() ? "" : ": " + result.stderr()));
    }
    final byte[] payload = decodeOutput(result.stdout());
    LOGGER.debug("{} captured {} bytes", name, payload.length);
    return FrameCodec.fromPayload(payload, name, region);
  }

  /**
   * Extracts the base64 image from script output. Only the last non-blank line is used.
   *
   * @param stdout raw output
   * @return decoded PNG bytes
   * @throws IOException if no output or invalid base64
   */
  static byte[] decodeOutput(final byte[] stdout) throws IOException {
    final String text = stdout == null ? "" : new String(stdout, StandardCharsets.US_ASCII);
    String last = null;
    for (final String line : text.split("\\R")) {
      if (StringUtils.isNotBlank(line)) {
        last = line.trim();
      }
    }
    if (last == null) {
      throw new IOException("PowerShell produced no output");
    }
    try {
      return Base64.getDecoder().decode(last);
    } catch (final IllegalArgumentException e) {
      throw new IOException("PowerShell output is not valid base64", e);
    }
  }
}
