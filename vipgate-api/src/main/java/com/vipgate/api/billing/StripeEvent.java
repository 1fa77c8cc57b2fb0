package com.vipgate.api.billing;

import com.vipgate.domain.billing.BillingEvent;

import java.util.Optional;

/**
 * Envelope of one Stripe delivery.
 *
 * @param event empty when the type is not one the reconciler handles
 */
public record StripeEvent(String id, String type, Optional<BillingEvent> event) {}
