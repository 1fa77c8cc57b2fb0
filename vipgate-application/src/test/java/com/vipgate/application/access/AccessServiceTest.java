package com.vipgate.application.access;

import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.support.FakeDirectory;
import com.vipgate.application.support.InMemoryStores;
import com.vipgate.application.support.MutableClock;
import com.vipgate.domain.access.InviteLogEntry;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccessServiceTest {

  private static final Instant NOW = Instant.parse("2026-02-02T09:00:00Z");

  private MutableClock clock;
  private InMemoryStores.Subscriptions subscriptions;
  private InMemoryStores.InviteLog inviteLog;
  private FakeDirectory directory;
  private ReconcilerSettings settings;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    subscriptions = new InMemoryStores.Subscriptions();
    inviteLog = new InMemoryStores.InviteLog();
    directory = new FakeDirectory();
    settings = ReconcilerSettings.defaults().withGroupIds(List.of(-1L, -2L));
  }

  private AccessService service() {
    return new AccessService(subscriptions, inviteLog, directory, settings, clock);
  }

  private void activeUntil(String email, Instant expiresAt) {
    subscriptions.save(SubscriptionRecord.create(email, SubscriptionStatus.ACTIVE, NOW).withExpiresAt(expiresAt));
  }

  @Test
  void issuesOneInvitePerGroupAndLinksMemberId() {
    activeUntil("m@x.io", NOW.plus(Duration.ofDays(10)));

    UnlockResult r = service().unlock(" M@X.io ", "tg 12345");

    assertThat(r.outcome()).isEqualTo(UnlockResult.Outcome.GRANTED);
    assertThat(r.invites()).extracting(InviteLogEntry::groupId).containsExactly(-1L, -2L);
    assertThat(r.invites()).allMatch(i -> i.temporary() && i.expiresAt().equals(NOW.plus(Duration.ofHours(24))));
    assertThat(subscriptions.get("m@x.io").memberId()).isEqualTo("12345");
  }

  @Test
  void deniesExpiredOrUnknown() {
    activeUntil("old@x.io", NOW.minusSeconds(1));
    subscriptions.save(SubscriptionRecord.create("gone@x.io", SubscriptionStatus.AUTO_REMOVED, NOW));

    assertThat(service().unlock("old@x.io", null).outcome()).isEqualTo(UnlockResult.Outcome.DENIED);
    assertThat(service().unlock("gone@x.io", null).outcome()).isEqualTo(UnlockResult.Outcome.DENIED);
    assertThat(service().unlock("nobody@x.io", null).outcome()).isEqualTo(UnlockResult.Outcome.DENIED);
    assertThat(service().unlock("not-an-email", null).reason()).isEqualTo("invalid_email");
    assertThat(directory.invitesCreated).isEmpty();
  }

  @Test
  void cooldownReturnsPreviousLinks() {
    activeUntil("m@x.io", null);
    UnlockResult first = service().unlock("m@x.io", null);

    clock.advance(Duration.ofMinutes(1));
    UnlockResult second = service().unlock("m@x.io", null);

    assertThat(second.outcome()).isEqualTo(UnlockResult.Outcome.COOLDOWN);
    assertThat(second.invites()).containsExactlyInAnyOrderElementsOf(first.invites());
    assertThat(directory.invitesCreated).hasSize(2);

    clock.advance(Duration.ofMinutes(10));
    assertThat(service().unlock("m@x.io", null).outcome()).isEqualTo(UnlockResult.Outcome.GRANTED);
  }

  @Test
  void oneFailingGroupDoesNotBlockOthers() {
    activeUntil("m@x.io", null);
    directory.failingGroups.add(-1L);

    UnlockResult r = service().unlock("m@x.io", null);

    assertThat(r.invites()).extracting(InviteLogEntry::groupId).containsExactly(-2L);
  }

  @Test
  void fallsBackToStaticLink() {
    activeUntil("m@x.io", null);
    directory.failingGroups.addAll(List.of(-1L, -2L));

    assertThat(service().unlock("m@x.io", null).outcome()).isEqualTo(UnlockResult.Outcome.UNAVAILABLE);

    settings = settings.withFallbackInvite(true, "https://t.me/+static");
    UnlockResult r = service().unlock("m@x.io", null);

    assertThat(r.outcome()).isEqualTo(UnlockResult.Outcome.GRANTED);
    assertThat(r.invites()).singleElement().satisfies(i -> {
      assertThat(i.inviteLink()).isEqualTo("https://t.me/+static");
      assertThat(i.temporary()).isFalse();
    });
  }
}
