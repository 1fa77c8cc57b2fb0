package com.vipgate.domain.sweep;

import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Selection rules for the grace-period sweep.
 *
 * Candidate: ACTIVE or CANCELED with a known expiry more than {@code grace} in the past, or
 * CANCELED without any expiry. A cancellation keeps access for the period already paid for.
 * Grace set: ACTIVE with {@code 0 <= now - expiresAt <= grace}. ACTIVE without expiry is never
 * selected.
 */
public final class RemovalPolicy {

  private RemovalPolicy() {}

  public static boolean isRemovalCandidate(SubscriptionRecord r, Instant now, Duration grace) {
    if (r == null) return false;
    if (r.status() == SubscriptionStatus.CANCELED) {
      return r.expiresAt() == null || pastGrace(r.expiresAt(), now, grace);
    }
    if (r.status() != SubscriptionStatus.ACTIVE || r.expiresAt() == null) return false;
    return pastGrace(r.expiresAt(), now, grace);
  }

  private static boolean pastGrace(Instant expiresAt, Instant now, Duration grace) {
    return Duration.between(expiresAt, now).compareTo(grace) > 0;
  }

  public static boolean isInGracePeriod(SubscriptionRecord r, Instant now, Duration grace) {
    if (r == null || r.status() != SubscriptionStatus.ACTIVE || r.expiresAt() == null) return false;
    Duration overdue = Duration.between(r.expiresAt(), now);
    return !overdue.isNegative() && overdue.compareTo(grace) <= 0;
  }

  /**
   * Records whose expiry is strictly before this instant are past the grace period.
   */
  public static Instant removalCutoff(Instant now, Duration grace) {
    return now.minus(grace);
  }

  public static RemovalReason reasonFor(SubscriptionRecord r) {
    return r.status() == SubscriptionStatus.CANCELED ? RemovalReason.CANCELLED : RemovalReason.EXPIRED;
  }
}
