package com.vipgate.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Local subscription lifecycle state.
 *
 * AUTO_REMOVED / MANUALLY_REMOVED are terminal: billing events other than a paid invoice
 * never move a record out of them.
 */
public enum SubscriptionStatus {
  PENDING,
  ACTIVE,
  PAST_DUE,
  CANCELED,
  AUTO_REMOVED,
  MANUALLY_REMOVED;

  public boolean isTerminal() {
    return this == AUTO_REMOVED || this == MANUALLY_REMOVED;
  }

  public static Optional<SubscriptionStatus> parse(String raw) {
    if (raw == null || raw.isBlank()) return Optional.empty();
    try {
      return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
