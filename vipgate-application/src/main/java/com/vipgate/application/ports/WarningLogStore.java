package com.vipgate.application.ports;

import com.vipgate.domain.sweep.WarningLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WarningLogStore {

  /**
   * True when a SENT entry exists for this milestone.
   */
  boolean hasSent(UUID subscriptionId, int leadDays, Instant expiresAt);

  WarningLogEntry append(WarningLogEntry entry);

  List<WarningLogEntry> recent(int limit);
}
