package com.vipgate.domain.billing;

/**
 * A parsed, already-verified billing provider event.
 *
 * Closed set: handlers match on the concrete record type.
 */
public sealed interface BillingEvent
    permits CheckoutCompleted, InvoicePaid, SubscriptionUpdated, SubscriptionDeleted {

  /** Upstream event id, the deduplication key. */
  String eventId();

  EventKind kind();
}
