package com.vipgate.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Reconciled subscription state for one account email.
 *
 * Immutable: the reducer and the sweep produce new instances through the {@code with*} methods.
 *
 * @param version store revision this instance was read at, null until first stored; a save based on a
 *                stale revision is rejected
 */
public record SubscriptionRecord(
    UUID id,
    String email,
    String fullName,
    String memberId,
    String customerId,
    String billingSubscriptionId,
    String lastInvoiceId,
    PlanType plan,
    SubscriptionStatus status,
    Instant expiresAt,
    Instant createdAt,
    Instant updatedAt,
    Long version
) {

  public SubscriptionRecord {
    Objects.requireNonNull(id, "id");
    email = Emails.normalize(email);
    Objects.requireNonNull(email, "email");
    plan = plan == null ? PlanType.UNKNOWN : plan;
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public static SubscriptionRecord create(String email, SubscriptionStatus status, Instant now) {
    return new SubscriptionRecord(
        UUID.randomUUID(),
        email,
        null,
        null,
        null,
        null,
        null,
        PlanType.UNKNOWN,
        status,
        null,
        now,
        now,
        null
    );
  }

  public boolean hasMemberId() {
    return MemberIds.isPresent(memberId);
  }

  public SubscriptionRecord withFullName(String v) {
    return new SubscriptionRecord(id, email, v, memberId, customerId, billingSubscriptionId, lastInvoiceId,
        plan, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withMemberId(String v) {
    return new SubscriptionRecord(id, email, fullName, v, customerId, billingSubscriptionId, lastInvoiceId,
        plan, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withCustomerId(String v) {
    return new SubscriptionRecord(id, email, fullName, memberId, v, billingSubscriptionId, lastInvoiceId,
        plan, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withBillingSubscriptionId(String v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, v, lastInvoiceId,
        plan, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withLastInvoiceId(String v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, billingSubscriptionId, v,
        plan, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withPlan(PlanType v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, billingSubscriptionId, lastInvoiceId,
        v, status, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withStatus(SubscriptionStatus v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, billingSubscriptionId, lastInvoiceId,
        plan, v, expiresAt, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withExpiresAt(Instant v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, billingSubscriptionId, lastInvoiceId,
        plan, status, v, createdAt, updatedAt, version);
  }

  public SubscriptionRecord withUpdatedAt(Instant v) {
    return new SubscriptionRecord(id, email, fullName, memberId, customerId, billingSubscriptionId, lastInvoiceId,
        plan, status, expiresAt, createdAt, v, version);
  }
}
