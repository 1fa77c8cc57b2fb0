package com.vipgate.application.ports;

import java.time.Instant;

/**
 * Set of billing event ids that have already been applied.
 *
 * Storage failures propagate as runtime exceptions; callers must not treat them as "not processed".
 */
public interface ProcessedEventStore {

  boolean alreadyProcessed(String eventId);

  /**
   * Write-once. Recording an id that is already present is not an error.
   */
  void record(String eventId, String eventType, Instant receivedAt);

  /**
   * @return number of rows removed
   */
  int purgeOlderThan(Instant cutoff);
}
