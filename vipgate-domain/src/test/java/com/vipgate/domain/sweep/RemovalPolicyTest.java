package com.vipgate.domain.sweep;

import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RemovalPolicyTest {

  private static final Instant NOW = Instant.parse("2026-05-10T03:00:00Z");
  private static final Duration GRACE = Duration.ofDays(3);

  private static SubscriptionRecord active(Instant expiresAt) {
    return SubscriptionRecord.create("m@x.io", SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofDays(100)))
        .withExpiresAt(expiresAt);
  }

  @Test
  void futureExpiryIsNeverSelected() {
    assertThat(RemovalPolicy.isRemovalCandidate(active(NOW.plus(Duration.ofDays(1))), NOW, GRACE)).isFalse();
  }

  @Test
  void graceBoundaryIsStrict() {
    SubscriptionRecord justPast = active(NOW.minus(GRACE).minusSeconds(1));
    SubscriptionRecord inGrace = active(NOW.minus(Duration.ofDays(2)));
    SubscriptionRecord exactlyAtGrace = active(NOW.minus(GRACE));

    assertThat(RemovalPolicy.isRemovalCandidate(justPast, NOW, GRACE)).isTrue();
    assertThat(RemovalPolicy.isRemovalCandidate(inGrace, NOW, GRACE)).isFalse();
    assertThat(RemovalPolicy.isRemovalCandidate(exactlyAtGrace, NOW, GRACE)).isFalse();

    assertThat(RemovalPolicy.isInGracePeriod(inGrace, NOW, GRACE)).isTrue();
    assertThat(RemovalPolicy.isInGracePeriod(exactlyAtGrace, NOW, GRACE)).isTrue();
    assertThat(RemovalPolicy.isInGracePeriod(justPast, NOW, GRACE)).isFalse();
  }

  @Test
  void activeWithoutExpiryIsNeverSelected() {
    assertThat(RemovalPolicy.isRemovalCandidate(active(null), NOW, GRACE)).isFalse();
    assertThat(RemovalPolicy.isInGracePeriod(active(null), NOW, GRACE)).isFalse();
  }

  @Test
  void canceledWaitsForExpiryPlusGrace() {
    SubscriptionRecord paidAhead = active(NOW.plus(Duration.ofDays(20))).withStatus(SubscriptionStatus.CANCELED);
    SubscriptionRecord inGrace = active(NOW.minus(Duration.ofDays(2))).withStatus(SubscriptionStatus.CANCELED);
    SubscriptionRecord pastGrace = active(NOW.minus(GRACE).minusSeconds(1)).withStatus(SubscriptionStatus.CANCELED);
    SubscriptionRecord noExpiry = active(null).withStatus(SubscriptionStatus.CANCELED);

    assertThat(RemovalPolicy.isRemovalCandidate(paidAhead, NOW, GRACE)).isFalse();
    assertThat(RemovalPolicy.isRemovalCandidate(inGrace, NOW, GRACE)).isFalse();
    assertThat(RemovalPolicy.isRemovalCandidate(pastGrace, NOW, GRACE)).isTrue();
    assertThat(RemovalPolicy.isRemovalCandidate(noExpiry, NOW, GRACE)).isTrue();
    assertThat(RemovalPolicy.reasonFor(pastGrace)).isEqualTo(RemovalReason.CANCELLED);
  }

  @Test
  void otherStatusesAreIgnored() {
    SubscriptionRecord pastDue = active(NOW.minus(Duration.ofDays(30))).withStatus(SubscriptionStatus.PAST_DUE);
    SubscriptionRecord removed = active(NOW.minus(Duration.ofDays(30))).withStatus(SubscriptionStatus.AUTO_REMOVED);

    assertThat(RemovalPolicy.isRemovalCandidate(pastDue, NOW, GRACE)).isFalse();
    assertThat(RemovalPolicy.isRemovalCandidate(removed, NOW, GRACE)).isFalse();
  }
}
