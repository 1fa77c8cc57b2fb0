package com.vipgate.application.sweep;

/**
 * Result of asking the engine for a sweep.
 *
 * @param report null unless {@code status == COMPLETED}
 */
public record SweepRun(Status status, SweepReport report) {

  public enum Status {
    COMPLETED,
    /** Another sweep was in flight; this trigger was dropped. */
    SKIPPED_IN_FLIGHT,
    /** Auto-removal is switched off. */
    DISABLED
  }

  public static SweepRun completed(SweepReport report) {
    return new SweepRun(Status.COMPLETED, report);
  }

  public static SweepRun skipped() {
    return new SweepRun(Status.SKIPPED_IN_FLIGHT, null);
  }

  public static SweepRun disabled() {
    return new SweepRun(Status.DISABLED, null);
  }
}
