package com.vipgate.domain.billing;

import com.vipgate.domain.model.SubscriptionStatus;

import java.util.Locale;
import java.util.Map;

/**
 * Provider subscription status vocabulary to local status.
 */
public final class ProviderStatusMapper {

  private static final Map<String, SubscriptionStatus> TABLE = Map.of(
      "active", SubscriptionStatus.ACTIVE,
      "trialing", SubscriptionStatus.ACTIVE,
      "past_due", SubscriptionStatus.PAST_DUE,
      "canceled", SubscriptionStatus.CANCELED,
      "unpaid", SubscriptionStatus.CANCELED,
      "incomplete", SubscriptionStatus.PENDING,
      "incomplete_expired", SubscriptionStatus.CANCELED
  );

  private ProviderStatusMapper() {}

  /**
   * Unknown or missing values map to PENDING.
   */
  public static SubscriptionStatus map(String providerStatus) {
    if (providerStatus == null) return SubscriptionStatus.PENDING;
    return TABLE.getOrDefault(providerStatus.trim().toLowerCase(Locale.ROOT), SubscriptionStatus.PENDING);
  }
}
