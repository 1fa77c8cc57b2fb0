package com.vipgate.domain.billing;

/**
 * A checkout session finished.
 *
 * @param paymentCaptured  provider reported the payment as paid
 * @param subscriptionMode the session created a recurring subscription (vs. a one-off payment)
 */
public record CheckoutCompleted(
    String eventId,
    String sessionId,
    String email,
    String fullName,
    String memberIdHint,
    String customerId,
    String subscriptionId,
    boolean paymentCaptured,
    boolean subscriptionMode
) implements BillingEvent {

  @Override
  public EventKind kind() {
    return EventKind.CHECKOUT_COMPLETED;
  }
}
