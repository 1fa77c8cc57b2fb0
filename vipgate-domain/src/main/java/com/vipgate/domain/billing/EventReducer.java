package com.vipgate.domain.billing;

import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.MemberIds;
import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds one billing event onto the current subscription record.
 *
 * Pure: no I/O, the clock is passed in. Every rule is a fixed point, so applying the same event
 * twice yields the same record as applying it once:
 * - checkout only fills empty fields and only upgrades PENDING to ACTIVE
 * - invoice expiry never moves backwards, and the last applied invoice id is remembered
 * - status events leave terminal states alone
 */
public final class EventReducer {

  private final PlanResolver plans;

  public EventReducer(PlanResolver plans) {
    this.plans = Objects.requireNonNull(plans, "plans");
  }

  /**
   * @param current record resolved for this event by the caller, or null if none exists
   */
  public Reduction reduce(SubscriptionRecord current, BillingEvent event, Instant now) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(now, "now");

    if (event instanceof CheckoutCompleted c) return checkout(current, c, now);
    if (event instanceof InvoicePaid i) return invoice(current, i, now);
    if (event instanceof SubscriptionUpdated u) return statusChange(current, ProviderStatusMapper.map(u.providerStatus()), now);
    if (event instanceof SubscriptionDeleted) return statusChange(current, SubscriptionStatus.CANCELED, now);

    throw new IllegalArgumentException("Unsupported billing event: " + event.getClass().getName());
  }

  private Reduction checkout(SubscriptionRecord current, CheckoutCompleted e, Instant now) {
    String email = Emails.normalize(e.email());
    if (email == null) {
      return Reduction.ignored(current, "missing_email");
    }
    String memberHint = MemberIds.digitsOnly(e.memberIdHint());
    String name = blankToNull(e.fullName());

    if (current == null) {
      if (!e.subscriptionMode()) {
        return Reduction.ignored(null, "non_subscription_checkout");
      }
      SubscriptionStatus status = e.paymentCaptured() ? SubscriptionStatus.ACTIVE : SubscriptionStatus.PENDING;
      SubscriptionRecord created = SubscriptionRecord.create(email, status, now)
          .withFullName(name)
          .withMemberId(memberHint)
          .withCustomerId(blankToNull(e.customerId()))
          .withBillingSubscriptionId(blankToNull(e.subscriptionId()));
      return Reduction.of(created, ChangeKind.CREATED);
    }

    SubscriptionRecord next = current;
    if (isBlank(next.fullName()) && name != null) next = next.withFullName(name);
    if (!next.hasMemberId() && memberHint != null) next = next.withMemberId(memberHint);

    boolean activated = false;
    if (e.subscriptionMode()) {
      if (isBlank(next.customerId()) && !isBlank(e.customerId())) next = next.withCustomerId(e.customerId().trim());
      if (isBlank(next.billingSubscriptionId()) && !isBlank(e.subscriptionId())) {
        next = next.withBillingSubscriptionId(e.subscriptionId().trim());
      }
      if (e.paymentCaptured() && next.status() == SubscriptionStatus.PENDING) {
        next = next.withStatus(SubscriptionStatus.ACTIVE);
        activated = true;
      }
    }

    if (next.equals(current)) {
      return Reduction.unchanged(current, "nothing_to_fill");
    }
    return Reduction.of(next.withUpdatedAt(now), activated ? ChangeKind.ACTIVATED : ChangeKind.UPDATED);
  }

  private Reduction invoice(SubscriptionRecord current, InvoicePaid e, Instant now) {
    String email = Emails.normalize(e.email());
    if (current == null && email == null) {
      return Reduction.ignored(null, "no_target");
    }
    if (current != null && !isBlank(e.invoiceId()) && e.invoiceId().equals(current.lastInvoiceId())) {
      return Reduction.unchanged(current, "invoice_already_applied");
    }

    PlanResolution plan = plans.resolve(e.priceId(), e.lineDescription());

    SubscriptionRecord base = current != null
        ? current
        : SubscriptionRecord.create(email, SubscriptionStatus.ACTIVE, now);

    SubscriptionRecord next = base;
    if (isBlank(next.customerId()) && !isBlank(e.customerId())) next = next.withCustomerId(e.customerId().trim());
    if (isBlank(next.billingSubscriptionId()) && !isBlank(e.subscriptionId())) {
      next = next.withBillingSubscriptionId(e.subscriptionId().trim());
    }
    if (plan.isKnown()) next = next.withPlan(plan.plan());
    if (!isBlank(e.invoiceId())) next = next.withLastInvoiceId(e.invoiceId());

    Instant previousExpiry = base.expiresAt();
    Instant nextExpiry = nextExpiry(previousExpiry, e.periodEnd(), plan.plan(), now);
    next = next.withStatus(SubscriptionStatus.ACTIVE).withExpiresAt(nextExpiry);

    ChangeKind change;
    if (current == null) {
      change = ChangeKind.CREATED;
    } else if (current.status() != SubscriptionStatus.ACTIVE) {
      change = ChangeKind.ACTIVATED;
    } else if (isLater(nextExpiry, previousExpiry)) {
      change = ChangeKind.EXTENDED;
    } else if (!next.equals(current)) {
      change = ChangeKind.UPDATED;
    } else {
      return Reduction.unchanged(current, "no_new_information").withPlanSource(plan.source());
    }

    if (current != null) next = next.withUpdatedAt(now);
    return Reduction.of(next, change).withPlanSource(plan.source());
  }

  /**
   * Authoritative period end wins but never shortens a known expiry. Without one, a known plan
   * extends from the later of now and the current expiry. Otherwise the expiry is kept.
   */
  static Instant nextExpiry(Instant current, Instant periodEnd, PlanType plan, Instant now) {
    if (periodEnd != null) {
      return (current != null && current.isAfter(periodEnd)) ? current : periodEnd;
    }
    Optional<Duration> period = plan == null ? Optional.empty() : plan.period();
    if (period.isPresent()) {
      Instant from = (current != null && current.isAfter(now)) ? current : now;
      return from.plus(period.get());
    }
    return current;
  }

  private Reduction statusChange(SubscriptionRecord current, SubscriptionStatus target, Instant now) {
    if (current == null) {
      return Reduction.ignored(null, "unknown_subscription");
    }
    if (current.status().isTerminal()) {
      return Reduction.unchanged(current, "terminal_state");
    }
    if (current.status() == target) {
      return Reduction.unchanged(current, "same_status");
    }

    ChangeKind change = target == SubscriptionStatus.ACTIVE ? ChangeKind.ACTIVATED : ChangeKind.DEACTIVATED;
    return Reduction.of(current.withStatus(target).withUpdatedAt(now), change);
  }

  private static boolean isLater(Instant a, Instant b) {
    if (a == null) return false;
    return b == null || a.isAfter(b);
  }

  private static boolean isBlank(String v) {
    return v == null || v.isBlank();
  }

  private static String blankToNull(String v) {
    return isBlank(v) ? null : v.trim();
  }
}
