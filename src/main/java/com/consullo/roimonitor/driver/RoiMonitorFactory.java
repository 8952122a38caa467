package com.consullo.roimonitor.driver;

import com.consullo.roimonitor.capture.CaptureChain;
import com.consullo.roimonitor.capture.CaptureChainConfig;
import com.consullo.roimonitor.capture.CaptureStrategies;
import com.consullo.roimonitor.capture.PlatformDetector;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.detection.ChangeDetectionStrategyFactory;
import com.consullo.roimonitor.events.MonitorEventBus;
import com.consullo.roimonitor.monitor.RoiMonitor;
import com.consullo.roimonitor.monitor.RoiMonitorConfig;
import com.consullo.roimonitor.process.DefaultProcessRunner;
import com.consullo.roimonitor.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating ROI monitors with sensible defaults.
 *
 * <p>
 * This class centralizes the decisions around:
 * <ul>
 * <li>platform detection for the running JVM</li>
 * <li>capture strategy priority for that platform</li>
 * <li>timeouts and failure limits</li>
 * </ul>
 * </p>
 */
public final class RoiMonitorFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoiMonitorFactory.class);

  private RoiMonitorFactory() {
  }

  /**
   * Create a monitor for the current platform with default configuration.
   *
   * @return runtime owning the monitor
   */
  public static MonitorRuntime createDefault() {
    ProcessRunner runner = new DefaultProcessRunner(System.getenv());
    PlatformCapabilities caps = PlatformDetector.forCurrentProcess(runner).detect();
    return create(caps, runner, CaptureChainConfig.defaults(), RoiMonitorConfig.defaults());
  }

  /**
   * Create a monitor for explicit capabilities.
   *
   * @param caps platform capabilities
   * @param runner runner for external capture tools
   * @param chainConfig capture chain configuration
   * @param monitorConfig monitor configuration
   * @return runtime owning the monitor
   */
  public static MonitorRuntime create(
      PlatformCapabilities caps,
      ProcessRunner runner,
      CaptureChainConfig chainConfig,
      RoiMonitorConfig monitorConfig) {
    if (caps == null || runner == null || chainConfig == null || monitorConfig == null) {
      throw new IllegalArgumentException("caps/runner/chainConfig/monitorConfig must not be null.");
    }

    CaptureChain chain = new CaptureChain(
        caps,
        CaptureStrategies.defaultsFor(caps, runner, chainConfig.attemptTimeout()),
        chainConfig);
    if (chain.strategyNames().isEmpty()) {
      LOGGER.warn("No capture strategy is usable on {}; every capture will fail", caps.operatingSystem());
    }
    MonitorEventBus bus = new MonitorEventBus();
    RoiMonitor monitor = new RoiMonitor(chain, bus, ChangeDetectionStrategyFactory.defaults(), monitorConfig);
    return new MonitorRuntime(caps, chain, bus, monitor);
  }
}
