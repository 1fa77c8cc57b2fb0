package com.vipgate.domain.sweep;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit row for one reconciliation decision.
 *
 * @param id      store-assigned, null before the entry is appended
 * @param sweepId correlates all entries written by one sweep run
 */
public record RemovalLogEntry(
    Long id,
    String sweepId,
    String email,
    String memberId,
    RemovalReason reason,
    RemovalLogStatus status,
    List<Long> groupsRemoved,
    List<Long> groupsFailed,
    boolean notified,
    String error,
    Instant createdAt
) {
  public RemovalLogEntry {
    groupsRemoved = groupsRemoved == null ? List.of() : List.copyOf(groupsRemoved);
    groupsFailed = groupsFailed == null ? List.of() : List.copyOf(groupsFailed);
  }

  public static RemovalLogEntry decision(String sweepId, String email, String memberId, RemovalReason reason,
                                         RemovalLogStatus status, String error, Instant at) {
    return new RemovalLogEntry(null, sweepId, email, memberId, reason, status, List.of(), List.of(), false, error, at);
  }
}
