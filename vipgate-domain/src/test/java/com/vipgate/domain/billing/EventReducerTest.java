package com.vipgate.domain.billing;

import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EventReducerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final EventReducer reducer = new EventReducer(PlanResolver.of("price_m", "price_q", "price_y"));

  private static CheckoutCompleted checkout(String email, boolean paid) {
    return new CheckoutCompleted("evt_c", "cs_1", email, "Ana Souza", "tg: 4242", "cus_1", "sub_1", paid, true);
  }

  private static InvoicePaid invoice(String invoiceId, String priceId, Instant periodEnd) {
    return new InvoicePaid("evt_" + invoiceId, invoiceId, "a@b.com", "cus_1", "sub_1", priceId, periodEnd, null);
  }

  @Nested
  class Checkout {

    @Test
    void createsActiveRecordWhenPaymentCaptured() {
      Reduction r = reducer.reduce(null, checkout("  A@B.com ", true), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.CREATED);
      SubscriptionRecord rec = r.record();
      assertThat(rec.email()).isEqualTo("a@b.com");
      assertThat(rec.status()).isEqualTo(SubscriptionStatus.ACTIVE);
      assertThat(rec.expiresAt()).isNull();
      assertThat(rec.memberId()).isEqualTo("4242");
      assertThat(rec.fullName()).isEqualTo("Ana Souza");
      assertThat(rec.billingSubscriptionId()).isEqualTo("sub_1");
      assertThat(rec.plan()).isEqualTo(PlanType.UNKNOWN);
    }

    @Test
    void createsPendingRecordWithoutCapturedPayment() {
      Reduction r = reducer.reduce(null, checkout("a@b.com", false), NOW);

      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.PENDING);
    }

    @Test
    void dropsEventWithoutEmail() {
      Reduction r = reducer.reduce(null, checkout("  ", true), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.IGNORED);
      assertThat(r.reason()).isEqualTo("missing_email");
      assertThat(r.record()).isNull();
    }

    @Test
    void onlyFillsEmptyFieldsOnExistingRecord() {
      SubscriptionRecord existing = SubscriptionRecord.create("a@b.com", SubscriptionStatus.ACTIVE, NOW.minusSeconds(60))
          .withFullName("Original")
          .withMemberId("111");

      Reduction r = reducer.reduce(existing, checkout("a@b.com", true), NOW);

      assertThat(r.record().fullName()).isEqualTo("Original");
      assertThat(r.record().memberId()).isEqualTo("111");
      assertThat(r.record().customerId()).isEqualTo("cus_1");
      assertThat(r.change()).isEqualTo(ChangeKind.UPDATED);
    }

    @Test
    void upgradesPendingButNeverDowngradesTerminal() {
      SubscriptionRecord pending = SubscriptionRecord.create("a@b.com", SubscriptionStatus.PENDING, NOW);
      assertThat(reducer.reduce(pending, checkout("a@b.com", true), NOW).change()).isEqualTo(ChangeKind.ACTIVATED);

      SubscriptionRecord removed = SubscriptionRecord.create("a@b.com", SubscriptionStatus.AUTO_REMOVED, NOW);
      Reduction r = reducer.reduce(removed, checkout("a@b.com", true), NOW);
      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.AUTO_REMOVED);
    }

    @Test
    void nonSubscriptionCheckoutNeverCreates() {
      CheckoutCompleted oneOff = new CheckoutCompleted("evt", "cs", "a@b.com", "Ana", null, null, null, true, false);

      Reduction r = reducer.reduce(null, oneOff, NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.IGNORED);
      assertThat(r.record()).isNull();
    }
  }

  @Nested
  class Invoice {

    @Test
    void sameInvoiceAppliedTwiceIsAFixedPoint() {
      InvoicePaid e = invoice("in_1", "price_m", null);

      SubscriptionRecord once = reducer.reduce(null, e, NOW).record();
      Reduction twice = reducer.reduce(once, e, NOW.plusSeconds(5));

      assertThat(twice.change()).isEqualTo(ChangeKind.UNCHANGED);
      assertThat(twice.record()).isEqualTo(once);
      assertThat(once.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void laterEventWithEarlierPeriodEndDoesNotShortenExpiry() {
      Instant t1 = NOW.plus(Duration.ofDays(60));
      Instant t2 = NOW.plus(Duration.ofDays(20));

      SubscriptionRecord first = reducer.reduce(null, invoice("in_2", "price_m", t1), NOW).record();
      Reduction second = reducer.reduce(first, invoice("in_1", "price_m", t2), NOW);

      assertThat(second.record().expiresAt()).isEqualTo(t1);
    }

    @Test
    void planExtensionStartsFromLaterOfNowAndCurrentExpiry() {
      Instant future = NOW.plus(Duration.ofDays(10));
      SubscriptionRecord active = SubscriptionRecord.create("a@b.com", SubscriptionStatus.ACTIVE, NOW).withExpiresAt(future);

      Reduction r = reducer.reduce(active, invoice("in_9", "price_q", null), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.EXTENDED);
      assertThat(r.record().expiresAt()).isEqualTo(future.plus(Duration.ofDays(90)));
      assertThat(r.record().plan()).isEqualTo(PlanType.QUARTERLY);

      SubscriptionRecord lapsed = active.withExpiresAt(NOW.minus(Duration.ofDays(40)));
      assertThat(reducer.reduce(lapsed, invoice("in_10", "price_y", null), NOW).record().expiresAt())
          .isEqualTo(NOW.plus(Duration.ofDays(365)));
    }

    @Test
    void reactivatesTerminalRecord() {
      SubscriptionRecord removed = SubscriptionRecord.create("a@b.com", SubscriptionStatus.AUTO_REMOVED, NOW)
          .withExpiresAt(NOW.minus(Duration.ofDays(10)));

      Reduction r = reducer.reduce(removed, invoice("in_3", "price_m", null), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.ACTIVATED);
      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void reportsDescriptionHeuristic() {
      InvoicePaid e = new InvoicePaid("evt", "in_4", "a@b.com", null, null, "price_unmapped", null, "1 × VIP (per year)");

      Reduction r = reducer.reduce(null, e, NOW);

      assertThat(r.planSource()).isEqualTo(PlanResolution.Source.DESCRIPTION_HEURISTIC);
      assertThat(r.record().plan()).isEqualTo(PlanType.ANNUAL);
    }

    @Test
    void unknownPlanWithoutPeriodEndKeepsExpiry() {
      InvoicePaid e = new InvoicePaid("evt", "in_5", "a@b.com", null, null, null, null, null);

      Reduction r = reducer.reduce(null, e, NOW);

      assertThat(r.record().expiresAt()).isNull();
      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void ignoredWithoutEmailOrTarget() {
      InvoicePaid e = new InvoicePaid("evt", "in_6", null, null, "sub_x", "price_m", null, null);

      assertThat(reducer.reduce(null, e, NOW).change()).isEqualTo(ChangeKind.IGNORED);
    }
  }

  @Nested
  class StatusEvents {

    @Test
    void mapsProviderStatus() {
      SubscriptionRecord active = SubscriptionRecord.create("a@b.com", SubscriptionStatus.ACTIVE, NOW);

      Reduction r = reducer.reduce(active, new SubscriptionUpdated("evt", "sub_1", "cus_1", "past_due"), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.DEACTIVATED);
      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.PAST_DUE);
    }

    @Test
    void deletionKeepsExpiry() {
      Instant exp = NOW.plus(Duration.ofDays(12));
      SubscriptionRecord active = SubscriptionRecord.create("a@b.com", SubscriptionStatus.ACTIVE, NOW).withExpiresAt(exp);

      Reduction r = reducer.reduce(active, new SubscriptionDeleted("evt", "sub_1", null), NOW);

      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.CANCELED);
      assertThat(r.record().expiresAt()).isEqualTo(exp);
    }

    @Test
    void terminalStatesAreNotOverwritten() {
      SubscriptionRecord removed = SubscriptionRecord.create("a@b.com", SubscriptionStatus.MANUALLY_REMOVED, NOW);

      Reduction r = reducer.reduce(removed, new SubscriptionUpdated("evt", "sub_1", null, "active"), NOW);

      assertThat(r.change()).isEqualTo(ChangeKind.UNCHANGED);
      assertThat(r.record().status()).isEqualTo(SubscriptionStatus.MANUALLY_REMOVED);
    }

    @Test
    void unknownSubscriptionIsIgnored() {
      assertThat(reducer.reduce(null, new SubscriptionDeleted("evt", "sub_404", null), NOW).change())
          .isEqualTo(ChangeKind.IGNORED);
    }
  }
}
