package com.vipgate.application;

import com.vipgate.domain.billing.ChangeKind;
import com.vipgate.domain.billing.EventKind;

/**
 * Optional observer for reconciler telemetry.
 * Keeps metrics wiring out of the services.
 */
public interface ReconcilerObserver {

  ReconcilerObserver NOOP = new ReconcilerObserver() {};

  default void onEventApplied(EventKind kind, ChangeKind change) {}
  default void onEventDuplicate(EventKind kind) {}
  default void onEventIgnored(EventKind kind, String reason) {}

  default void onSweepCompleted(int removed, int failed) {}
  default void onSweepSkipped(String why) {}

  default void onRemovalSucceeded() {}
  default void onRemovalFailed() {}

  default void onWarningSent() {}
  default void onWarningFailed() {}
}
