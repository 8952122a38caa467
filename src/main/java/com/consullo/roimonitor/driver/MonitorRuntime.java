package com.consullo.roimonitor.driver;

import com.consullo.roimonitor.capture.CaptureChain;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.events.MonitorEventBus;
import com.consullo.roimonitor.monitor.RoiMonitor;

/**
 * A wired monitor together with the collaborators it owns.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>Capture chain (platform strategies with fallback)</li>
 * <li>Event bus</li>
 * <li>ROI monitor</li>
 * </ul>
 * </p>
 */
public final class MonitorRuntime implements AutoCloseable {

  private final PlatformCapabilities capabilities;
  private final CaptureChain captureChain;
  private final MonitorEventBus eventBus;
  private final RoiMonitor monitor;

  MonitorRuntime(PlatformCapabilities capabilities, CaptureChain captureChain, MonitorEventBus eventBus,
      RoiMonitor monitor) {
    if (capabilities == null || captureChain == null || eventBus == null || monitor == null) {
      throw new IllegalArgumentException("capabilities/captureChain/eventBus/monitor must not be null.");
    }
    this.capabilities = capabilities;
    this.captureChain = captureChain;
    this.eventBus = eventBus;
    this.monitor = monitor;
  }

  public PlatformCapabilities capabilities() {
    return capabilities;
  }

  public CaptureChain captureChain() {
    return captureChain;
  }

  public MonitorEventBus eventBus() {
    return eventBus;
  }

  public RoiMonitor monitor() {
    return monitor;
  }

  /**
   * Stops any active session, then releases the capture workers.
   */
  @Override
  public void close() {
    try {
      monitor.close();
    } finally {
      captureChain.close();
    }
  }
}
