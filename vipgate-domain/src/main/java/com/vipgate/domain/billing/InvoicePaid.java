package com.vipgate.domain.billing;

import java.time.Instant;

/**
 * A billing period was charged.
 *
 * @param periodEnd end of the paid period as reported by the provider, null when absent
 */
public record InvoicePaid(
    String eventId,
    String invoiceId,
    String email,
    String customerId,
    String subscriptionId,
    String priceId,
    Instant periodEnd,
    String lineDescription
) implements BillingEvent {

  @Override
  public EventKind kind() {
    return EventKind.INVOICE_PAID;
  }
}
