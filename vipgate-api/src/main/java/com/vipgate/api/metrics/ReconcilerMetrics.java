package com.vipgate.api.metrics;

import com.vipgate.application.ReconcilerObserver;
import com.vipgate.domain.billing.ChangeKind;
import com.vipgate.domain.billing.EventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Reconciler counters.
 *
 * Exposes:
 * - vipgate.billing.events{outcome=applied|duplicate|ignored, kind=...}
 * - vipgate.sweep.runs{result=completed|skipped}
 * - vipgate.sweep.removals{result=succeeded|failed}
 * - vipgate.warnings{result=sent|failed}
 */
@Component
public class ReconcilerMetrics implements ReconcilerObserver {

  private final MeterRegistry registry;

  private final Counter sweepsCompleted;
  private final Counter sweepsSkipped;
  private final Counter removalsSucceeded;
  private final Counter removalsFailed;
  private final Counter warningsSent;
  private final Counter warningsFailed;

  public ReconcilerMetrics(MeterRegistry registry) {
    this.registry = registry;

    this.sweepsCompleted = Counter.builder("vipgate.sweep.runs")
        .tag("result", "completed")
        .description("Sweep runs that went through the candidate list")
        .register(registry);
    this.sweepsSkipped = Counter.builder("vipgate.sweep.runs")
        .tag("result", "skipped")
        .description("Sweep triggers skipped (in flight or disabled)")
        .register(registry);
    this.removalsSucceeded = Counter.builder("vipgate.sweep.removals")
        .tag("result", "succeeded")
        .register(registry);
    this.removalsFailed = Counter.builder("vipgate.sweep.removals")
        .tag("result", "failed")
        .register(registry);
    this.warningsSent = Counter.builder("vipgate.warnings")
        .tag("result", "sent")
        .register(registry);
    this.warningsFailed = Counter.builder("vipgate.warnings")
        .tag("result", "failed")
        .register(registry);
  }

  @Override
  public void onEventApplied(EventKind kind, ChangeKind change) {
    eventCounter("applied", kind).increment();
  }

  @Override
  public void onEventDuplicate(EventKind kind) {
    eventCounter("duplicate", kind).increment();
  }

  @Override
  public void onEventIgnored(EventKind kind, String reason) {
    eventCounter("ignored", kind).increment();
  }

  @Override
  public void onSweepCompleted(int removed, int failed) {
    sweepsCompleted.increment();
  }

  @Override
  public void onSweepSkipped(String why) {
    sweepsSkipped.increment();
  }

  @Override
  public void onRemovalSucceeded() {
    removalsSucceeded.increment();
  }

  @Override
  public void onRemovalFailed() {
    removalsFailed.increment();
  }

  @Override
  public void onWarningSent() {
    warningsSent.increment();
  }

  @Override
  public void onWarningFailed() {
    warningsFailed.increment();
  }

  // registry caches by name + tags
  private Counter eventCounter(String outcome, EventKind kind) {
    return Counter.builder("vipgate.billing.events")
        .tag("outcome", outcome)
        .tag("kind", kind == null ? "unknown" : kind.name().toLowerCase(Locale.ROOT))
        .register(registry);
  }
}
