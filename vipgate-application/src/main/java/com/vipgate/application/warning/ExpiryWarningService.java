package com.vipgate.application.warning;

import com.vipgate.application.ReconcilerObserver;
import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.notify.MessageTemplates;
import com.vipgate.application.ports.NotificationException;
import com.vipgate.application.ports.NotifierPort;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.application.ports.WarningLogStore;
import com.vipgate.domain.model.MemberIds;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.sweep.WarningLogEntry;
import com.vipgate.domain.sweep.WarningStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends "your access expires in N days" reminders.
 *
 * For each lead time the window is the whole local day {@code today + lead} in the configured zone.
 * A milestone (subscription, lead, expiresAt) is sent at most once; failures are retried on the
 * next pass, and a renewal that moves the expiry opens new milestones.
 */
public class ExpiryWarningService {

  private static final Logger log = LoggerFactory.getLogger(ExpiryWarningService.class);

  private final SubscriptionStore subscriptions;
  private final WarningLogStore warningLog;
  private final NotifierPort notifier;
  private final MessageTemplates messages;
  private final ReconcilerSettings settings;
  private final Clock clock;
  private final ReconcilerObserver observer;

  private final AtomicBoolean running = new AtomicBoolean(false);

  public ExpiryWarningService(
      SubscriptionStore subscriptions,
      WarningLogStore warningLog,
      NotifierPort notifier,
      MessageTemplates messages,
      ReconcilerSettings settings,
      Clock clock,
      ReconcilerObserver observer
  ) {
    this.subscriptions = subscriptions;
    this.warningLog = warningLog;
    this.notifier = notifier;
    this.messages = messages;
    this.settings = settings;
    this.clock = clock;
    this.observer = observer == null ? ReconcilerObserver.NOOP : observer;
  }

  public WarningReport run() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Expiry warning pass skipped: previous pass still running");
      return new WarningReport(0, 0, 0);
    }
    try {
      return runOnce();
    } finally {
      running.set(false);
    }
  }

  private WarningReport runOnce() {
    ZoneId zone = settings.zone();
    LocalDate today = LocalDate.now(clock.withZone(zone));
    int sent = 0;
    int failed = 0;
    int already = 0;

    for (int lead : settings.warningLeadDays()) {
      LocalDate day = today.plusDays(lead);
      Instant from = day.atStartOfDay(zone).toInstant();
      Instant to = day.plusDays(1).atStartOfDay(zone).toInstant();

      for (SubscriptionRecord r : subscriptions.findActiveExpiringBetween(from, to)) {
        if (!MemberIds.isValid(r.memberId())) {
          log.debug("No usable member id for {}, warning for lead {} not sent", r.email(), lead);
          continue;
        }
        if (warningLog.hasSent(r.id(), lead, r.expiresAt())) {
          already++;
          continue;
        }
        if (send(r, lead)) {
          sent++;
        } else {
          failed++;
        }
      }
    }

    log.info("Expiry warnings: sent={} failed={} alreadySent={}", sent, failed, already);
    return new WarningReport(sent, failed, already);
  }

  private boolean send(SubscriptionRecord r, int lead) {
    String error = null;
    try {
      notifier.sendDirectMessage(Long.parseLong(r.memberId().trim()), messages.expiryWarning(lead, r.expiresAt()));
    } catch (NotificationException e) {
      error = e.getMessage();
      log.warn("Expiry warning (lead {}) to {} failed: {}", lead, r.email(), e.getMessage());
    }

    WarningStatus status = error == null ? WarningStatus.SENT : WarningStatus.FAILED;
    warningLog.append(new WarningLogEntry(null, r.id(), r.email(), r.memberId(), lead, r.expiresAt(), status, error,
        clock.instant()));
    if (status == WarningStatus.SENT) {
      observer.onWarningSent();
      return true;
    }
    observer.onWarningFailed();
    return false;
  }
}
