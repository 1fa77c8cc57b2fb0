package com.vipgate.domain.billing;

public record SubscriptionDeleted(
    String eventId,
    String subscriptionId,
    String customerId
) implements BillingEvent {

  @Override
  public EventKind kind() {
    return EventKind.SUBSCRIPTION_DELETED;
  }
}
