package com.consullo.roimonitor.core;

import java.util.Set;

/**
 * Description of the capture environment, produced once by platform detection and passed explicitly to
 * whatever needs it.
 *
 * @param operatingSystem value of the {@code os.name} property at detection time
 * @param windows true on native Windows
 * @param wsl true inside Windows Subsystem for Linux
 * @param wayland true when a Wayland compositor is reachable
 * @param x11 true when an X11 display is reachable
 * @param headless true when AWT cannot access a display
 * @param availableTools executables found on the search path (e.g. "grim", "scrot", "powershell.exe")
 * @param virtualDisplay bounds of the whole virtual display, or null when unknown
 * @since 1.0
 */
public record PlatformCapabilities(
    String operatingSystem,
    boolean windows,
    boolean wsl,
    boolean wayland,
    boolean x11,
    boolean headless,
    Set<String> availableTools,
    Region virtualDisplay) {

  public PlatformCapabilities {
    availableTools = availableTools == null ? Set.of() : Set.copyOf(availableTools);
  }

  /**
   * Returns true if the named executable was found during detection.
   *
   * @param tool executable name
   * @return true if available
   */
  public boolean hasTool(String tool) {
    return availableTools.contains(tool);
  }

  /**
   * Returns a copy with different virtual display bounds.
   *
   * @param bounds new bounds, may be null
   * @return capabilities
   */
  public PlatformCapabilities withVirtualDisplay(Region bounds) {
    return new PlatformCapabilities(operatingSystem, windows, wsl, wayland, x11, headless, availableTools, bounds);
  }
}
