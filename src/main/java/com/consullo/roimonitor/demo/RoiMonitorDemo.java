package com.consullo.roimonitor.demo;

import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.detection.DetectionStrategyType;
import com.consullo.roimonitor.driver.MonitorRuntime;
import com.consullo.roimonitor.driver.RoiMonitorFactory;
import com.consullo.roimonitor.events.CaptureFailed;
import com.consullo.roimonitor.events.ChangeDetected;
import com.consullo.roimonitor.events.MonitoringStarted;
import com.consullo.roimonitor.events.MonitoringStopped;
import com.consullo.roimonitor.monitor.MonitorStatus;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line demo that watches a region and logs every lifecycle and change event.
 *
 * <p>Usage: {@code RoiMonitorDemo left top right bottom [strategy] [threshold] [intervalMs]}. Runs until
 * interrupted or until the session fails.
 *
 * @since 1.0
 */
public final class RoiMonitorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoiMonitorDemo.class);

  private RoiMonitorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length < 4) {
      System.err.println("usage: RoiMonitorDemo left top right bottom [size|pixel|hash] [threshold] [intervalMs]");
      System.exit(2);
      return;
    }
    final Region region = Region.of(new int[] {
      Integer.parseInt(args[0]), Integer.parseInt(args[1]), Integer.parseInt(args[2]), Integer.parseInt(args[3])
    });
    final DetectionStrategyType strategy =
            args.length > 4 ? DetectionStrategyType.fromWireName(args[4]) : DetectionStrategyType.PIXEL;
    final double threshold = args.length > 5 ? Double.parseDouble(args[5]) : 5.0;
    final long intervalMillis = args.length > 6 ? Long.parseLong(args[6]) : 1_000L;

    final CountDownLatch finished = new CountDownLatch(1);
    try (final MonitorRuntime runtime = RoiMonitorFactory.createDefault()) {
      LOGGER.info("{}", runtime.captureChain().describe());

      runtime.eventBus().subscribe(MonitoringStarted.class,
              e -> LOGGER.info("Started session {} on {}", e.sessionId(), e.region()));
      runtime.eventBus().subscribe(ChangeDetected.class,
              e -> LOGGER.info("Change: magnitude={} frame={}", e.verdict().magnitude(), e.frame()));
      runtime.eventBus().subscribe(CaptureFailed.class,
              e -> LOGGER.warn("Capture failed ({}): {}", e.consecutiveFailures(), e.error().getMessage()));
      runtime.eventBus().subscribe(MonitoringStopped.class, e -> {
        LOGGER.info("Stopped: {}", e.reason());
        finished.countDown();
      });

      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        runtime.monitor().stop("interrupted");
        finished.countDown();
      }, "RoiMonitorDemoShutdown"));

      runtime.monitor().start(region, strategy, threshold, intervalMillis);
      finished.await();

      final MonitorStatus status = runtime.monitor().getStatus();
      LOGGER.info("Final status: state={}, ticks={}, changes={}, uptime={}",
              status.state(), status.ticks(), status.changesDetected(), status.uptime());
    }
  }
}
