package com.vipgate.application.admin;

import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionStatus;

import java.time.Instant;

/**
 * Operator-supplied subscription state. Billing-owned markers (last invoice id) are never set here.
 */
public record SubscriptionDraft(
    String email,
    String fullName,
    String memberId,
    String customerId,
    String billingSubscriptionId,
    PlanType plan,
    SubscriptionStatus status,
    Instant expiresAt
) {}
