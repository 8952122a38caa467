package com.consullo.roimonitor.monitor;

import com.consullo.roimonitor.capture.CaptureException;
import com.consullo.roimonitor.capture.CaptureSource;
import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.InvalidRegionException;
import com.consullo.roimonitor.core.Region;
import com.consullo.roimonitor.core.RoiMonitorException;
import com.consullo.roimonitor.detection.ChangeDetectionStrategyFactory;
import com.consullo.roimonitor.detection.DetectionContext;
import com.consullo.roimonitor.detection.DetectionStrategyType;
import com.consullo.roimonitor.detection.DetectionVerdict;
import com.consullo.roimonitor.events.CaptureFailed;
import com.consullo.roimonitor.events.ChangeDetected;
import com.consullo.roimonitor.events.MonitorEvent;
import com.consullo.roimonitor.events.MonitorEventBus;
import com.consullo.roimonitor.events.MonitorEventListener;
import com.consullo.roimonitor.events.MonitoringStarted;
import com.consullo.roimonitor.events.MonitoringStopped;
import com.consullo.roimonitor.events.RegionUpdated;
import com.consullo.roimonitor.events.StrategyChanged;
import com.consullo.roimonitor.events.Subscription;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches one display region and publishes an event whenever its content changes.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>One session at a time, ticking on its own daemon worker thread.</li>
 * <li>All session state is guarded by a single lock; control calls may come from any thread.</li>
 * <li>A tick snapshots what it needs under the lock, captures and compares without it, then re-locks to
 * commit. A commit is dropped if the baseline or strategy was replaced in the meantime.</li>
 * <li>Events are published while holding the lock so that subscribers observe them in state order.</li>
 * <li>Errors inside the loop never escape the worker; they become {@link CaptureFailed} events.</li>
 * </ul>
 * </p>
 */
public final class RoiMonitor implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoiMonitor.class);

  public static final String REASON_SHUTDOWN = "shutdown";

  private final CaptureSource captureSource;
  private final MonitorEventBus eventBus;
  private final ChangeDetectionStrategyFactory strategyFactory;
  private final RoiMonitorConfig config;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wakeup = lock.newCondition();

  // Guarded by lock.
  private MonitorState state = MonitorState.IDLE;
  private Session session;
  private boolean starting;
  private boolean closed;

  /**
   * Mutable state of one monitoring session. Every field except the finals is guarded by the monitor lock.
   */
  private static final class Session {
    final String id;
    final DetectionContext context;
    final MonitoringStatistics statistics;
    final Deque<ChangeRecord> changeHistory = new ArrayDeque<>();
    Region region;
    long intervalMillis;
    int consecutiveFailures;
    Thread worker;

    Session(String id, Region region, long intervalMillis, DetectionContext context, Instant startedAt) {
      this.id = id;
      this.region = region;
      this.intervalMillis = intervalMillis;
      this.context = context;
      this.statistics = new MonitoringStatistics(startedAt);
    }
  }

  public RoiMonitor(CaptureSource captureSource, MonitorEventBus eventBus) {
    this(captureSource, eventBus, ChangeDetectionStrategyFactory.defaults(), RoiMonitorConfig.defaults());
  }

  public RoiMonitor(
      CaptureSource captureSource,
      MonitorEventBus eventBus,
      ChangeDetectionStrategyFactory strategyFactory,
      RoiMonitorConfig config) {
    if (captureSource == null || eventBus == null || strategyFactory == null || config == null) {
      throw new IllegalArgumentException("captureSource/eventBus/strategyFactory/config must not be null.");
    }
    this.captureSource = captureSource;
    this.eventBus = eventBus;
    this.strategyFactory = strategyFactory;
    this.config = config;
  }

  /**
   * Starts a new session. A synchronous initial capture seeds the baseline before the loop begins.
   *
   * @param region region to watch
   * @param strategy change-detection strategy
   * @param threshold change threshold, 0 to 100
   * @param intervalMillis poll interval
   * @return new session id
   * @throws InvalidRegionException if the region is invalid; the monitor state is unchanged
   * @throws AlreadyRunningException if a session is running, paused or starting
   * @throws CaptureException if the initial capture fails; the session is then FAILED
   * @throws IllegalStateException if the monitor is closed, also when it is closed during the initial capture
   */
  public String start(Region region, DetectionStrategyType strategy, double threshold, long intervalMillis)
      throws RoiMonitorException {
    Validate.notNull(region, "region must not be null");
    Validate.notNull(strategy, "strategy must not be null");
    DetectionContext.validateThreshold(threshold);
    Validate.isTrue(intervalMillis >= config.minimumIntervalMillis(),
        "intervalMillis must be at least %s, was %s", config.minimumIntervalMillis(), intervalMillis);
    region.validate();

    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Monitor is closed.");
      }
      if (starting) {
        throw new AlreadyRunningException(null, MonitorState.RUNNING);
      }
      if (state.isActive()) {
        throw new AlreadyRunningException(session.id, state);
      }
      starting = true;
    } finally {
      lock.unlock();
    }

    try {
      String id = UUID.randomUUID().toString();
      DetectionContext context = new DetectionContext(strategyFactory, strategy, threshold);
      Instant startedAt = Instant.now();
      Session candidate = new Session(id, region, intervalMillis, context, startedAt);

      Frame initial;
      try {
        initial = captureSource.capture(region);
      } catch (CaptureException e) {
        failInitialCapture(candidate, e);
        throw e;
      }

      lock.lock();
      try {
        if (closed) {
          LOGGER.info("Monitor closed during the initial capture of session {}; not starting", id);
          throw new IllegalStateException("Monitor was closed while starting.");
        }
        context.resetBaseline(initial);
        candidate.statistics.recordFrame();
        session = candidate;
        state = MonitorState.RUNNING;
        Thread worker = new Thread(() -> runLoop(candidate), "roi-monitor-" + id.substring(0, 8));
        worker.setDaemon(true);
        candidate.worker = worker;
        LOGGER.info("Monitoring session {} started: region={}, strategy={}, threshold={}, interval={} ms",
            id, region, strategy.wireName(), threshold, intervalMillis);
        eventBus.publish(new MonitoringStarted(Instant.now(), id, region, strategy, threshold, intervalMillis));
        worker.start();
      } finally {
        lock.unlock();
      }
      return id;
    } finally {
      lock.lock();
      try {
        starting = false;
      } finally {
        lock.unlock();
      }
    }
  }

  /**
   * Stops the active session. Calling this while idle, stopped or failed does nothing.
   *
   * @param reason reason carried by {@link MonitoringStopped}
   */
  public void stop(String reason) {
    Thread worker;
    lock.lock();
    try {
      if (!state.isActive()) {
        LOGGER.debug("stop({}) ignored in state {}", reason, state);
        return;
      }
      Session s = session;
      state = MonitorState.STOPPED;
      s.statistics.recordEnd(Instant.now());
      worker = s.worker;
      wakeup.signalAll();
      LOGGER.info("Monitoring session {} stopped: {} ({})", s.id, reason, s.statistics);
      eventBus.publish(new MonitoringStopped(Instant.now(), s.id, reason, false));
    } finally {
      lock.unlock();
    }
    if (worker != null && worker != Thread.currentThread()) {
      worker.interrupt();
    }
  }

  /**
   * Suspends ticking. The baseline and statistics are kept.
   */
  public void pause() {
    lock.lock();
    try {
      requireState(MonitorState.RUNNING, "pause");
      state = MonitorState.PAUSED;
      LOGGER.info("Monitoring session {} paused", session.id);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Resumes a paused session. The next tick runs one full interval later.
   */
  public void resume() {
    lock.lock();
    try {
      requireState(MonitorState.PAUSED, "resume");
      state = MonitorState.RUNNING;
      wakeup.signalAll();
      LOGGER.info("Monitoring session {} resumed", session.id);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Switches the change-detection strategy of the active session.
   *
   * @param strategy new strategy
   * @param resetBaseline true to make the next capture the new baseline without comparing it
   */
  public void changeStrategy(DetectionStrategyType strategy, boolean resetBaseline) {
    Validate.notNull(strategy, "strategy must not be null");
    lock.lock();
    try {
      requireActive("changeStrategy");
      Session s = session;
      DetectionStrategyType previous = s.context.setStrategy(strategy, resetBaseline);
      LOGGER.info("Monitoring session {} strategy {} -> {} (baseline reset={})",
          s.id, previous.wireName(), strategy.wireName(), resetBaseline);
      eventBus.publish(new StrategyChanged(Instant.now(), s.id, previous, strategy, resetBaseline));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Clears the baseline of the active session. The next capture becomes the new baseline without a comparison,
   * and a tick already in flight is discarded.
   */
  public void resetBaseline() {
    lock.lock();
    try {
      requireActive("resetBaseline");
      session.context.resetBaseline(null);
      LOGGER.info("Monitoring session {} baseline reset", session.id);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replaces the monitored region and clears the baseline. The next tick re-seeds it.
   *
   * @param region new region
   * @throws InvalidRegionException if the region is invalid; the session is unchanged
   */
  public void updateRegion(Region region) throws InvalidRegionException {
    Validate.notNull(region, "region must not be null");
    region.validate();
    lock.lock();
    try {
      requireActive("updateRegion");
      Session s = session;
      Region previous = s.region;
      s.region = region;
      s.context.resetBaseline(null);
      LOGGER.info("Monitoring session {} region {} -> {}", s.id, previous, region);
      eventBus.publish(new RegionUpdated(Instant.now(), s.id, previous, region));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets the threshold used from the next comparison on.
   *
   * @param threshold threshold, 0 to 100
   */
  public void updateThreshold(double threshold) {
    DetectionContext.validateThreshold(threshold);
    lock.lock();
    try {
      requireActive("updateThreshold");
      session.context.setThreshold(threshold);
      LOGGER.info("Monitoring session {} threshold set to {}", session.id, threshold);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets the poll interval used from the next wait on.
   *
   * @param intervalMillis interval
   */
  public void updateInterval(long intervalMillis) {
    Validate.isTrue(intervalMillis >= config.minimumIntervalMillis(),
        "intervalMillis must be at least %s, was %s", config.minimumIntervalMillis(), intervalMillis);
    lock.lock();
    try {
      requireActive("updateInterval");
      session.intervalMillis = intervalMillis;
      LOGGER.info("Monitoring session {} interval set to {} ms", session.id, intervalMillis);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Captures immediately without waiting for the next tick.
   *
   * <p>While idle the full display is captured and nothing is compared. While running or paused the region
   * is captured and compared with the baseline; a change is committed and published like a regular tick.
   * The tick timer is not reset. A failure is published as {@link CaptureFailed} but does not count towards
   * the consecutive-failure limit.
   *
   * @return captured frame
   * @throws CaptureException if every capture strategy failed
   * @throws InvalidRegionException if the region no longer fits the display
   * @throws IllegalStateException if the session is stopped or failed
   */
  public Frame forceCapture() throws CaptureException, InvalidRegionException {
    Session s;
    Region region;
    DetectionContext.Snapshot snapshot;
    lock.lock();
    try {
      if (state.isTerminal()) {
        throw new IllegalStateException("forceCapture is not allowed in state " + state + ".");
      }
      if (state == MonitorState.IDLE) {
        s = null;
        region = null;
        snapshot = null;
      } else {
        s = session;
        region = s.region;
        snapshot = s.context.snapshot();
      }
    } finally {
      lock.unlock();
    }

    if (s == null) {
      return captureSource.capture(null);
    }

    Frame candidate;
    try {
      candidate = captureSource.capture(region);
    } catch (CaptureException | InvalidRegionException e) {
      lock.lock();
      try {
        if (isCurrent(s)) {
          s.statistics.recordFailure();
          eventBus.publish(new CaptureFailed(Instant.now(), s.id, e, s.consecutiveFailures));
        }
      } finally {
        lock.unlock();
      }
      throw e;
    }

    DetectionVerdict verdict = snapshot.hasBaseline() ? snapshot.compare(candidate) : null;
    lock.lock();
    try {
      if (isCurrent(s)) {
        s.statistics.recordFrame();
        commit(s, snapshot, candidate, verdict, true);
      }
    } finally {
      lock.unlock();
    }
    return candidate;
  }

  /**
   * Returns a consistent view of the current or last session.
   *
   * @return status
   */
  public MonitorStatus getStatus() {
    lock.lock();
    try {
      Instant now = Instant.now();
      if (session == null) {
        return MonitorStatus.idle(now);
      }
      Session s = session;
      return new MonitorStatus(
          s.id,
          state,
          s.region,
          s.context.strategyType(),
          s.context.threshold(),
          s.intervalMillis,
          s.consecutiveFailures,
          s.statistics.copy(),
          now);
    } finally {
      lock.unlock();
    }
  }

  public MonitorState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the current baseline frame, empty while idle or after a baseline reset.
   *
   * @return baseline
   */
  public Optional<Frame> currentBaseline() {
    lock.lock();
    try {
      return session == null ? Optional.empty() : session.context.baseline();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a listener on the monitor's event bus.
   *
   * @param eventType event class
   * @param listener listener
   * @param <E> event type
   * @return subscription
   */
  /**
   * Returns the most recent changes of the current or last session, oldest first.
   *
   * @param limit maximum number of entries; 0 returns the whole retained history
   * @return immutable copy of the history
   */
  public List<ChangeRecord> getChangeHistory(int limit) {
    Validate.isTrue(limit >= 0, "limit must not be negative, was %s", limit);
    lock.lock();
    try {
      if (session == null) {
        return List.of();
      }
      List<ChangeRecord> history = new ArrayList<>(session.changeHistory);
      if (limit > 0 && history.size() > limit) {
        history = history.subList(history.size() - limit, history.size());
      }
      return List.copyOf(history);
    } finally {
      lock.unlock();
    }
  }

  public <E extends MonitorEvent> Subscription subscribe(Class<E> eventType, MonitorEventListener<? super E> listener) {
    return eventBus.subscribe(eventType, listener);
  }

  public MonitorEventBus eventBus() {
    return eventBus;
  }

  /**
   * Waits for the worker of the current or last session to exit.
   *
   * @param timeout maximum wait
   * @return true if no worker is running
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    Thread worker;
    lock.lock();
    try {
      worker = session == null ? null : session.worker;
    } finally {
      lock.unlock();
    }
    if (worker == null) {
      return true;
    }
    worker.join(Math.max(1L, timeout.toMillis()));
    return !worker.isAlive();
  }

  /**
   * Stops the active session with reason {@value #REASON_SHUTDOWN} and rejects further starts.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      closed = true;
    } finally {
      lock.unlock();
    }
    stop(REASON_SHUTDOWN);
  }

  private void failInitialCapture(Session candidate, CaptureException e) {
    lock.lock();
    try {
      candidate.consecutiveFailures = 1;
      candidate.statistics.recordFailure();
      candidate.statistics.recordEnd(Instant.now());
      session = candidate;
      state = MonitorState.FAILED;
      LOGGER.error("Monitoring session {} failed on initial capture: {}", candidate.id, e.getMessage());
      eventBus.publish(new CaptureFailed(Instant.now(), candidate.id, e, 1));
    } finally {
      lock.unlock();
    }
  }

  private void runLoop(Session s) {
    LOGGER.debug("Worker for session {} running", s.id);
    try {
      while (true) {
        Region region;
        DetectionContext.Snapshot snapshot;
        lock.lock();
        try {
          if (!awaitNextTick(s)) {
            return;
          }
          region = s.region;
          snapshot = s.context.snapshot();
        } catch (InterruptedException e) {
          if (!isCurrent(s)) {
            return;
          }
          continue;
        } finally {
          lock.unlock();
        }
        tick(s, region, snapshot);
      }
    } finally {
      LOGGER.debug("Worker for session {} exited", s.id);
    }
  }

  /**
   * Waits one interval while running, and indefinitely while paused. Must hold the lock.
   *
   * @return false once the session is no longer current
   */
  private boolean awaitNextTick(Session s) throws InterruptedException {
    long remaining = TimeUnit.MILLISECONDS.toNanos(s.intervalMillis);
    while (isCurrent(s)) {
      if (state == MonitorState.PAUSED) {
        wakeup.await();
        remaining = TimeUnit.MILLISECONDS.toNanos(s.intervalMillis);
        continue;
      }
      if (remaining <= 0L) {
        return true;
      }
      remaining = wakeup.awaitNanos(remaining);
    }
    return false;
  }

  private void tick(Session s, Region region, DetectionContext.Snapshot snapshot) {
    Frame candidate;
    DetectionVerdict verdict;
    try {
      candidate = captureSource.capture(region);
      verdict = snapshot.hasBaseline() ? snapshot.compare(candidate) : null;
    } catch (CaptureException | InvalidRegionException e) {
      onTickFailure(s, e);
      return;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error in session {} tick", s.id, e);
      onTickFailure(s, new CaptureException("Unexpected tick error",
          List.of(new CaptureException.StrategyFailure("tick", String.valueOf(e.getMessage()), e))));
      return;
    }

    lock.lock();
    try {
      if (!isCurrent(s)) {
        return;
      }
      s.statistics.recordTick();
      s.statistics.recordFrame();
      s.consecutiveFailures = 0;
      commit(s, snapshot, candidate, verdict, false);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies a comparison result. Must hold the lock.
   */
  private void commit(Session s, DetectionContext.Snapshot snapshot, Frame candidate, DetectionVerdict verdict,
      boolean forced) {
    if (s.context.version() != snapshot.version()) {
      LOGGER.debug("Session {} discarding stale comparison", s.id);
      return;
    }
    if (verdict == null) {
      s.context.resetBaseline(candidate);
      LOGGER.debug("Session {} baseline seeded from {}", s.id, candidate);
      return;
    }
    LOGGER.debug("Session {} compared: changed={}, magnitude={}", s.id, verdict.changed(), verdict.magnitude());
    if (!verdict.changed()) {
      return;
    }
    s.context.resetBaseline(candidate);
    s.statistics.recordChange(verdict.magnitude(), verdict.comparedAt());
    if (s.changeHistory.size() >= config.changeHistoryCapacity()) {
      s.changeHistory.removeFirst();
    }
    s.changeHistory.addLast(new ChangeRecord(Instant.now(), verdict, forced));
    eventBus.publish(new ChangeDetected(Instant.now(), s.id, verdict, candidate, forced));
  }

  private void onTickFailure(Session s, RoiMonitorException error) {
    lock.lock();
    try {
      if (!isCurrent(s)) {
        return;
      }
      s.statistics.recordTick();
      s.statistics.recordFailure();
      s.consecutiveFailures++;
      LOGGER.warn("Session {} capture failed ({} in a row): {}", s.id, s.consecutiveFailures, error.getMessage());
      eventBus.publish(new CaptureFailed(Instant.now(), s.id, error, s.consecutiveFailures));
      if (s.consecutiveFailures >= config.maxConsecutiveFailures() && isCurrent(s)) {
        state = MonitorState.FAILED;
        s.statistics.recordEnd(Instant.now());
        wakeup.signalAll();
        LOGGER.error("Monitoring session {} failed after {} consecutive capture failures",
            s.id, s.consecutiveFailures);
        eventBus.publish(new MonitoringStopped(
            Instant.now(), s.id, MonitoringStopped.CAPTURE_FAILURES_EXCEEDED, true));
      }
    } finally {
      lock.unlock();
    }
  }

  private boolean isCurrent(Session s) {
    return session == s && state.isActive();
  }

  private void requireState(MonitorState expected, String operation) {
    if (state != expected) {
      throw new IllegalStateException(operation + " requires state " + expected + ", was " + state + ".");
    }
  }

  private void requireActive(String operation) {
    if (!state.isActive()) {
      throw new IllegalStateException(operation + " requires a running or paused session, was " + state + ".");
    }
  }
}
