package com.vipgate.domain.billing;

public record SubscriptionUpdated(
    String eventId,
    String subscriptionId,
    String customerId,
    String providerStatus
) implements BillingEvent {

  @Override
  public EventKind kind() {
    return EventKind.SUBSCRIPTION_UPDATED;
  }
}
