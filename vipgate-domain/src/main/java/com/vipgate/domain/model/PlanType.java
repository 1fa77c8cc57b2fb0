package com.vipgate.domain.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Billing plan with its fixed access period.
 */
public enum PlanType {
  MONTHLY(30),
  QUARTERLY(90),
  ANNUAL(365),
  UNKNOWN(0);

  private final int days;

  PlanType(int days) {
    this.days = days;
  }

  public int days() {
    return days;
  }

  /**
   * Access period granted by one paid billing cycle, empty for UNKNOWN.
   */
  public Optional<Duration> period() {
    return days <= 0 ? Optional.empty() : Optional.of(Duration.ofDays(days));
  }

  public static PlanType parse(String raw) {
    if (raw == null || raw.isBlank()) return UNKNOWN;
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }
}
