package com.vipgate.domain.billing;

import java.util.List;
import java.util.Optional;

/**
 * Billing event kinds the reconciler understands, with the provider type strings that map to them.
 */
public enum EventKind {
  CHECKOUT_COMPLETED("checkout.session.completed"),
  INVOICE_PAID("invoice.paid", "invoice.payment_succeeded"),
  SUBSCRIPTION_UPDATED("customer.subscription.updated"),
  SUBSCRIPTION_DELETED("customer.subscription.deleted");

  private final List<String> providerTypes;

  EventKind(String... providerTypes) {
    this.providerTypes = List.of(providerTypes);
  }

  public List<String> providerTypes() {
    return providerTypes;
  }

  public static Optional<EventKind> fromProviderType(String type) {
    if (type == null) return Optional.empty();
    String t = type.trim();
    for (EventKind k : values()) {
      if (k.providerTypes.contains(t)) return Optional.of(k);
    }
    return Optional.empty();
  }
}
