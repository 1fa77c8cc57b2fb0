package com.vipgate.application.ports;

import com.vipgate.domain.sweep.RemovalLogEntry;

import java.util.List;

/**
 * Append-only removal audit trail.
 */
public interface RemovalLogStore {

  RemovalLogEntry append(RemovalLogEntry entry);

  List<RemovalLogEntry> recent(int limit);

  List<RemovalLogEntry> recentByEmail(String email, int limit);
}
