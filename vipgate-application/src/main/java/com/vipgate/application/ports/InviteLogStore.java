package com.vipgate.application.ports;

import com.vipgate.domain.access.InviteLogEntry;

import java.time.Instant;
import java.util.List;

public interface InviteLogStore {

  InviteLogEntry append(InviteLogEntry entry);

  /**
   * Invites issued for the email at or after {@code since}, newest first.
   */
  List<InviteLogEntry> findIssuedSince(String email, Instant since);
}
