package com.vipgate.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Manual exemption from automatic removal.
 */
public record WhitelistEntry(
    String memberId,
    String email,
    String reason,
    String addedBy,
    Instant createdAt
) {
  public WhitelistEntry {
    Objects.requireNonNull(memberId, "memberId");
    memberId = memberId.trim();
    email = Emails.normalize(email);
  }
}
