package com.consullo.roimonitor.capture;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameCodec;
import com.consullo.roimonitor.core.InvalidRegionException;
import com.consullo.roimonitor.core.PlatformCapabilities;
import com.consullo.roimonitor.core.Region;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of capture strategies with automatic fallback.
 *
 * <p>Strategy:
 * - only candidates supported by the platform capabilities are active, kept in priority order
 * - the first strategy that succeeds is memoized and tried first on later calls
 * - the memoized strategy gets {@code preferredAttempts} tries before the rest of the chain is scanned
 * - each attempt runs on a worker thread bounded by {@code attemptTimeout}
 * - requested regions are clamped to the virtual display; a clamped region below the minimum size is rejected
 *
 * @since 1.0
 */
public final class CaptureChain implements CaptureSource, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureChain.class);

  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  private final List<CaptureStrategy> candidates;
  private final CaptureChainConfig config;
  private final ExecutorService attemptExecutor;

  private volatile PlatformCapabilities capabilities;
  private volatile List<CaptureStrategy> strategies;

  private final AtomicReference<CaptureStrategy> preferred = new AtomicReference<>();

  /**
   * Region actually requested from the strategies.
   */
  private record Target(Region region, boolean clamped) {
  }

  /**
   * Creates a chain.
   *
   * @param capabilities detected platform capabilities
   * @param candidates strategies in priority order, highest first
   * @param config chain configuration
   */
  public CaptureChain(PlatformCapabilities capabilities, List<CaptureStrategy> candidates, CaptureChainConfig config) {
    Validate.notNull(capabilities, "capabilities must not be null");
    Validate.notNull(candidates, "candidates must not be null");
    Validate.noNullElements(candidates, "candidates must not contain null");
    Validate.notNull(config, "config must not be null");

    this.candidates = List.copyOf(candidates);
    this.config = config;
    this.attemptExecutor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "capture-attempt-" + THREAD_COUNTER.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    applyCapabilities(capabilities);
  }

  @Override
  public Frame capture(Region requested) throws CaptureException, InvalidRegionException {
    Target target = resolveTarget(requested);
    List<CaptureStrategy> active = strategies;
    if (active.isEmpty()) {
      throw new CaptureException("No capture strategy is available on " + capabilities.operatingSystem(), List.of());
    }

    List<CaptureException.StrategyFailure> failures = new ArrayList<>();
    CaptureStrategy memo = preferred.get();

    if (memo != null && active.contains(memo)) {
      for (int attempt = 1; attempt <= config.preferredAttempts(); attempt++) {
        try {
          return attempt(memo, target);
        } catch (AttemptFailedException e) {
          failures.add(e.failure);
        }
        if (Thread.currentThread().isInterrupted()) {
          throw new CaptureException("Capture interrupted", failures);
        }
      }
      LOGGER.warn("Preferred capture strategy {} failed {} times in a row, scanning the chain",
          memo.name(), config.preferredAttempts());
    }

    for (CaptureStrategy strategy : active) {
      if (strategy == memo) {
        continue;
      }
      try {
        Frame frame = attempt(strategy, target);
        promote(memo, strategy);
        return frame;
      } catch (AttemptFailedException e) {
        failures.add(e.failure);
      }
      if (Thread.currentThread().isInterrupted()) {
        throw new CaptureException("Capture interrupted", failures);
      }
    }

    if (memo != null) {
      preferred.compareAndSet(memo, null);
    }
    throw new CaptureException("All capture strategies failed", failures);
  }

  /**
   * Re-filters the candidates against fresh capabilities and forgets the preferred strategy.
   *
   * @param newCapabilities capabilities
   */
  public void updateCapabilities(PlatformCapabilities newCapabilities) {
    Validate.notNull(newCapabilities, "capabilities must not be null");
    applyCapabilities(newCapabilities);
    preferred.set(null);
  }

  public PlatformCapabilities capabilities() {
    return capabilities;
  }

  /**
   * Returns the names of the active strategies in priority order.
   *
   * @return strategy names
   */
  public List<String> strategyNames() {
    List<String> names = new ArrayList<>();
    for (CaptureStrategy s : strategies) {
      names.add(s.name());
    }
    return names;
  }

  /**
   * Returns the memoized strategy, if any call has succeeded yet.
   *
   * @return preferred strategy name
   */
  public Optional<String> preferredStrategyName() {
    CaptureStrategy memo = preferred.get();
    return memo == null ? Optional.empty() : Optional.of(memo.name());
  }

  /**
   * Human-readable summary of the chain for logs and diagnostics.
   *
   * @return description
   */
  public String describe() {
    return "CaptureChain{strategies=" + strategyNames()
        + ", preferred=" + preferredStrategyName().orElse("none")
        + ", display=" + capabilities.virtualDisplay() + "}";
  }

  @Override
  public void close() {
    attemptExecutor.shutdownNow();
  }

  private void applyCapabilities(PlatformCapabilities caps) {
    List<CaptureStrategy> active = new ArrayList<>();
    for (CaptureStrategy candidate : candidates) {
      if (candidate.isSupported(caps)) {
        active.add(candidate);
      } else {
        LOGGER.debug("Capture strategy {} not supported on this platform", candidate.name());
      }
    }
    this.capabilities = caps;
    this.strategies = List.copyOf(active);
    LOGGER.info("Capture chain for {}: {}", caps.operatingSystem(), strategyNames());
  }

  private void promote(CaptureStrategy previous, CaptureStrategy winner) {
    preferred.set(winner);
    if (previous != winner) {
      LOGGER.info("Preferred capture strategy is now {}", winner.name());
    }
  }

  private Target resolveTarget(Region requested) throws InvalidRegionException {
    Region bounds = capabilities.virtualDisplay();
    if (requested == null) {
      return new Target(null, false);
    }
    if (bounds == null || bounds.contains(requested)) {
      return new Target(requested, false);
    }
    Region clamped = requested.intersect(bounds);
    if (clamped == null) {
      throw new InvalidRegionException(requested, "Region " + requested + " lies outside the display " + bounds);
    }
    clamped.validate();
    LOGGER.debug("Region {} clamped to {}", requested, clamped);
    return new Target(clamped, true);
  }

  private Frame attempt(CaptureStrategy strategy, Target target) throws AttemptFailedException {
    Region nativeRegion = strategy.supportsRegion() ? target.region() : null;
    Future<Frame> future = attemptExecutor.submit(() -> strategy.capture(nativeRegion));
    Frame frame;
    try {
      frame = future.get(config.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw failed(strategy, "timed out after " + config.attemptTimeout().toMillis() + " ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw failed(strategy, "interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw failed(strategy, String.valueOf(cause.getMessage()), cause);
    }

    if (frame == null || frame.size() == 0) {
      throw failed(strategy, "returned an empty frame", null);
    }
    if (target.region() == null) {
      return frame;
    }
    if (nativeRegion == null) {
      frame = cropFullDisplay(strategy, frame, target.region());
    }
    return frame.toBuilder().region(target.region()).clamped(target.clamped()).build();
  }

  private Frame cropFullDisplay(CaptureStrategy strategy, Frame full, Region region) throws AttemptFailedException {
    Region origin = full.getRegion() != null ? full.getRegion() : capabilities.virtualDisplay();
    if (origin == null) {
      origin = new Region(0, 0, full.getWidth(), full.getHeight());
    }
    try {
      return FrameCodec.crop(full, region.relativeTo(origin), region);
    } catch (IOException e) {
      throw failed(strategy, "crop failed: " + e.getMessage(), e);
    }
  }

  private static AttemptFailedException failed(CaptureStrategy strategy, String message, Throwable cause) {
    LOGGER.warn("Capture strategy {} failed: {}", strategy.name(), message);
    return new AttemptFailedException(new CaptureException.StrategyFailure(strategy.name(), message, cause));
  }

  /**
   * Internal signal for one failed attempt.
   */
  private static final class AttemptFailedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient CaptureException.StrategyFailure failure;

    AttemptFailedException(CaptureException.StrategyFailure failure) {
      super(failure.message(), null, false, false);
      this.failure = failure;
    }
  }
}
