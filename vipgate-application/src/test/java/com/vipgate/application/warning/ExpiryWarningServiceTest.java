package com.vipgate.application.warning;

import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.notify.MessageTemplates;
import com.vipgate.application.support.FakeDirectory;
import com.vipgate.application.support.InMemoryStores;
import com.vipgate.application.support.MutableClock;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import com.vipgate.domain.sweep.WarningLogEntry;
import com.vipgate.domain.sweep.WarningStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiryWarningServiceTest {

  // 10:00 UTC on 2026-06-01
  private static final Instant NOW = Instant.parse("2026-06-01T10:00:00Z");

  private MutableClock clock;
  private InMemoryStores.Subscriptions subscriptions;
  private InMemoryStores.WarningLog warningLog;
  private FakeDirectory notifier;
  private ExpiryWarningService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    subscriptions = new InMemoryStores.Subscriptions();
    warningLog = new InMemoryStores.WarningLog();
    notifier = new FakeDirectory();
    ReconcilerSettings settings = ReconcilerSettings.defaults();
    service = new ExpiryWarningService(subscriptions, warningLog, notifier, new MessageTemplates(settings), settings,
        clock, null);
  }

  private SubscriptionRecord active(String email, String memberId, Instant expiresAt) {
    return subscriptions.save(SubscriptionRecord.create(email, SubscriptionStatus.ACTIVE, NOW)
        .withMemberId(memberId)
        .withExpiresAt(expiresAt));
  }

  @Test
  void warnsOnEachLeadDayOnce() {
    active("seven@x.io", "7", Instant.parse("2026-06-08T18:00:00Z"));
    active("three@x.io", "3", Instant.parse("2026-06-04T00:00:00Z"));
    active("today@x.io", "1", Instant.parse("2026-06-01T23:59:59Z"));
    active("five@x.io", "5", Instant.parse("2026-06-06T12:00:00Z"));

    WarningReport first = service.run();
    WarningReport second = service.run();

    assertThat(first.sent()).isEqualTo(3);
    assertThat(second.sent()).isZero();
    assertThat(second.alreadySent()).isEqualTo(3);
    assertThat(warningLog.entries).extracting(WarningLogEntry::leadDays).containsExactlyInAnyOrder(7, 3, 0);
    assertThat(notifier.messages).anyMatch(m -> m.startsWith("7:") && m.contains("in 7 days"));
    assertThat(notifier.messages).anyMatch(m -> m.startsWith("1:") && m.contains("expires today"));
  }

  @Test
  void failedWarningIsRetriedOnNextPass() {
    active("m@x.io", "42", NOW.plus(Duration.ofDays(3)));
    notifier.notifierDown = true;

    WarningReport first = service.run();
    notifier.notifierDown = false;
    WarningReport second = service.run();

    assertThat(first.failed()).isEqualTo(1);
    assertThat(second.sent()).isEqualTo(1);
    assertThat(warningLog.entries).extracting(WarningLogEntry::status)
        .containsExactly(WarningStatus.FAILED, WarningStatus.SENT);
  }

  @Test
  void renewalOpensNewMilestone() {
    SubscriptionRecord r = active("m@x.io", "42", NOW.plus(Duration.ofDays(1)));
    service.run();

    subscriptions.save(r.withExpiresAt(NOW.plus(Duration.ofDays(31))));
    clock.advance(Duration.ofDays(24));
    WarningReport later = service.run();

    assertThat(later.sent()).isEqualTo(1);
    assertThat(warningLog.entries).hasSize(2);
  }

  @Test
  void skipsMembersWithoutUsableId() {
    active("noid@x.io", null, NOW.plus(Duration.ofDays(1)));

    assertThat(service.run().sent()).isZero();
    assertThat(warningLog.entries).isEmpty();
  }
}
