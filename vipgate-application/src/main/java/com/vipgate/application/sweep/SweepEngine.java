package com.vipgate.application.sweep;

import com.vipgate.application.ReconcilerObserver;
import com.vipgate.application.config.ReconcilerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serializes sweep runs inside this process.
 *
 * Overlapping triggers are dropped, not queued. The lock is process-local: a single reconciler
 * instance is assumed.
 */
public class SweepEngine {

  private static final Logger log = LoggerFactory.getLogger(SweepEngine.class);

  private final GracePeriodSweeper sweeper;
  private final ReconcilerSettings settings;
  private final ReconcilerObserver observer;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicReference<SweepReport> lastReport = new AtomicReference<>();

  public SweepEngine(GracePeriodSweeper sweeper, ReconcilerSettings settings, ReconcilerObserver observer) {
    this.sweeper = sweeper;
    this.settings = settings;
    this.observer = observer == null ? ReconcilerObserver.NOOP : observer;
  }

  /**
   * @param source who asked (scheduler, catch-up, admin), for the log only
   */
  public SweepRun trigger(String source) {
    if (!settings.autoRemovalEnabled()) {
      log.info("Sweep requested by {} ignored: auto-removal disabled", source);
      observer.onSweepSkipped("disabled");
      return SweepRun.disabled();
    }
    if (!running.compareAndSet(false, true)) {
      log.warn("Sweep requested by {} skipped: previous sweep still running", source);
      observer.onSweepSkipped("in_flight");
      return SweepRun.skipped();
    }

    String sweepId = UUID.randomUUID().toString();
    try (MDC.MDCCloseable ignored = MDC.putCloseable("sweepId", sweepId)) {
      log.info("Sweep {} triggered by {}", sweepId, source);
      SweepReport report = sweeper.sweep(sweepId);
      lastReport.set(report);
      observer.onSweepCompleted(report.removed(), report.failed() + report.errors());
      return SweepRun.completed(report);
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public Optional<SweepReport> lastReport() {
    return Optional.ofNullable(lastReport.get());
  }

  public Optional<Instant> lastCompletedAt() {
    return lastReport().map(SweepReport::finishedAt);
  }
}
