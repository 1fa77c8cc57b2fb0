package com.vipgate.application.sweep;

import com.vipgate.application.ReconcilerObserver;
import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.notify.MessageTemplates;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.MembershipException;
import com.vipgate.application.ports.NotificationException;
import com.vipgate.application.ports.NotifierPort;
import com.vipgate.application.ports.RemovalLogStore;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.application.ports.WhitelistStore;
import com.vipgate.domain.model.MemberIds;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import com.vipgate.domain.model.WhitelistEntry;
import com.vipgate.domain.sweep.RemovalLogEntry;
import com.vipgate.domain.sweep.RemovalLogStatus;
import com.vipgate.domain.sweep.RemovalPolicy;
import com.vipgate.domain.sweep.RemovalReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One pass over subscriptions past their grace period.
 *
 * Per candidate, in order:
 * - the record is re-read; one renewed, reactivated or deleted since selection is left alone
 * - whitelist (member id or email) wins over everything and is only logged
 * - missing / non-numeric member id is logged, status untouched
 * - PROCESSING is logged, then removal from every managed group is attempted independently
 * - at least one group removed: best-effort notice, AUTO_REMOVED, SUCCESS entry
 * - no group removed: FAILED entry, status untouched so the next sweep retries
 *
 * Not thread-safe on its own; {@link SweepEngine} serializes runs.
 */
public class GracePeriodSweeper {

  private static final Logger log = LoggerFactory.getLogger(GracePeriodSweeper.class);

  private final SubscriptionStore subscriptions;
  private final WhitelistStore whitelist;
  private final RemovalLogStore removalLog;
  private final MembershipDirectoryPort directory;
  private final NotifierPort notifier;
  private final MessageTemplates messages;
  private final ReconcilerSettings settings;
  private final Clock clock;
  private final ReconcilerObserver observer;

  public GracePeriodSweeper(
      SubscriptionStore subscriptions,
      WhitelistStore whitelist,
      RemovalLogStore removalLog,
      MembershipDirectoryPort directory,
      NotifierPort notifier,
      MessageTemplates messages,
      ReconcilerSettings settings,
      Clock clock,
      ReconcilerObserver observer
  ) {
    this.subscriptions = subscriptions;
    this.whitelist = whitelist;
    this.removalLog = removalLog;
    this.directory = directory;
    this.notifier = notifier;
    this.messages = messages;
    this.settings = settings;
    this.clock = clock;
    this.observer = observer == null ? ReconcilerObserver.NOOP : observer;
  }

  public SweepReport sweep(String sweepId) {
    Instant startedAt = clock.instant();
    List<SubscriptionRecord> candidates = candidates(startedAt);
    log.info("Sweep {} started: {} candidate(s), grace={}", sweepId, candidates.size(), settings.gracePeriod());

    int removed = 0;
    int failed = 0;
    int whitelisted = 0;
    int skipped = 0;
    int errors = 0;

    for (SubscriptionRecord r : candidates) {
      Optional<RemovalLogStatus> current = process(sweepId, r);
      if (current.isEmpty()) {
        skipped++;
        continue;
      }
      RemovalLogStatus outcome = current.get();
      switch (outcome) {
        case SUCCESS -> removed++;
        case FAILED -> failed++;
        case WHITELISTED -> whitelisted++;
        case NO_MEMBER_ID, INVALID_MEMBER_ID -> skipped++;
        default -> errors++;
      }
    }

    Instant finishedAt = clock.instant();
    log.info("Sweep {} finished: removed={} failed={} whitelisted={} skipped={} errors={}",
        sweepId, removed, failed, whitelisted, skipped, errors);
    return new SweepReport(sweepId, startedAt, finishedAt, candidates.size(), removed, failed, whitelisted, skipped,
        errors);
  }

  /**
   * What the next sweep would do, without touching the directory, notifier or stores.
   */
  public List<SweepCandidate> preview() {
    Instant now = clock.instant();
    List<SweepCandidate> out = new ArrayList<>();
    for (SubscriptionRecord r : candidates(now)) {
      out.add(new SweepCandidate(r, RemovalPolicy.reasonFor(r), precheck(r).orElse(RemovalLogStatus.PROCESSING)));
    }
    return out;
  }

  /**
   * ACTIVE members whose expiry passed but who are still within the grace period.
   */
  public List<SubscriptionRecord> inGracePeriod() {
    Instant now = clock.instant();
    List<SubscriptionRecord> out = new ArrayList<>();
    for (SubscriptionRecord r : subscriptions.findActiveExpiringBetween(
        RemovalPolicy.removalCutoff(now, settings.gracePeriod()), now.plusNanos(1))) {
      if (RemovalPolicy.isInGracePeriod(r, now, settings.gracePeriod())) out.add(r);
    }
    out.sort(Comparator.comparing(SubscriptionRecord::expiresAt));
    return out;
  }

  private List<SubscriptionRecord> candidates(Instant now) {
    List<SubscriptionRecord> out = new ArrayList<>();
    for (SubscriptionRecord r : subscriptions.findRemovalCandidates(RemovalPolicy.removalCutoff(now, settings.gracePeriod()))) {
      if (RemovalPolicy.isRemovalCandidate(r, now, settings.gracePeriod())) out.add(r);
    }
    return out;
  }

  private Optional<RemovalLogStatus> precheck(SubscriptionRecord r) {
    Optional<WhitelistEntry> wl = whitelist.match(r.memberId(), r.email());
    if (wl.isPresent()) return Optional.of(RemovalLogStatus.WHITELISTED);
    if (!r.hasMemberId()) return Optional.of(RemovalLogStatus.NO_MEMBER_ID);
    if (!MemberIds.isValid(r.memberId())) return Optional.of(RemovalLogStatus.INVALID_MEMBER_ID);
    return Optional.empty();
  }

  /**
   * Empty when the record changed since the candidate query and is no longer due for removal.
   */
  private Optional<RemovalLogStatus> process(String sweepId, SubscriptionRecord snapshot) {
    SubscriptionRecord r = snapshot;
    RemovalReason reason = RemovalPolicy.reasonFor(r);
    try {
      Optional<SubscriptionRecord> fresh = subscriptions.findById(snapshot.id());
      if (fresh.isEmpty()
          || !RemovalPolicy.isRemovalCandidate(fresh.get(), clock.instant(), settings.gracePeriod())) {
        log.info("Sweep {}: {} changed since selection, no longer due for removal", sweepId, snapshot.email());
        return Optional.empty();
      }
      r = fresh.get();
      reason = RemovalPolicy.reasonFor(r);

      Optional<RemovalLogStatus> skip = precheck(r);
      if (skip.isPresent()) {
        log.info("Sweep {}: {} not removed ({})", sweepId, r.email(), skip.get());
        removalLog.append(RemovalLogEntry.decision(sweepId, r.email(), r.memberId(), reason, skip.get(), null,
            clock.instant()));
        return skip;
      }

      if (settings.groupIds().isEmpty()) {
        log.error("Sweep {}: no managed groups configured, cannot remove {}", sweepId, r.email());
        removalLog.append(RemovalLogEntry.decision(sweepId, r.email(), r.memberId(), reason, RemovalLogStatus.ERROR,
            "no groups configured", clock.instant()));
        observer.onRemovalFailed();
        return Optional.of(RemovalLogStatus.ERROR);
      }

      removalLog.append(RemovalLogEntry.decision(sweepId, r.email(), r.memberId(), reason,
          RemovalLogStatus.PROCESSING, null, clock.instant()));
      return Optional.of(remove(sweepId, r, reason));
    } catch (RuntimeException e) {
      log.error("Sweep {}: unexpected error for {}", sweepId, r.email(), e);
      observer.onRemovalFailed();
      try {
        removalLog.append(RemovalLogEntry.decision(sweepId, r.email(), r.memberId(), reason, RemovalLogStatus.ERROR,
            e.getClass().getSimpleName() + ": " + e.getMessage(), clock.instant()));
      } catch (RuntimeException logFailure) {
        log.error("Sweep {}: could not log error for {}", sweepId, r.email(), logFailure);
      }
      return Optional.of(RemovalLogStatus.ERROR);
    }
  }

  private RemovalLogStatus remove(String sweepId, SubscriptionRecord r, RemovalReason reason) {
    long memberId = Long.parseLong(r.memberId().trim());
    List<Long> removedFrom = new ArrayList<>();
    List<Long> failedIn = new ArrayList<>();
    String lastError = null;

    for (Long groupId : settings.groupIds()) {
      try {
        directory.removeMember(groupId, memberId);
        removedFrom.add(groupId);
      } catch (MembershipException e) {
        failedIn.add(groupId);
        lastError = "group " + groupId + ": " + e.getMessage();
        log.warn("Sweep {}: removing {} from group {} failed: {}", sweepId, memberId, groupId, e.getMessage());
      }
    }

    if (removedFrom.isEmpty()) {
      removalLog.append(new RemovalLogEntry(null, sweepId, r.email(), r.memberId(), reason, RemovalLogStatus.FAILED,
          List.of(), failedIn, false, lastError, clock.instant()));
      observer.onRemovalFailed();
      return RemovalLogStatus.FAILED;
    }

    boolean notified = notifyRemoved(sweepId, memberId);
    Instant now = clock.instant();
    subscriptions.save(r.withStatus(SubscriptionStatus.AUTO_REMOVED).withUpdatedAt(now));
    removalLog.append(new RemovalLogEntry(null, sweepId, r.email(), r.memberId(), reason, RemovalLogStatus.SUCCESS,
        removedFrom, failedIn, notified, lastError, now));
    observer.onRemovalSucceeded();
    log.info("Sweep {}: removed {} from {} group(s), failed in {}, notified={}",
        sweepId, r.email(), removedFrom.size(), failedIn.size(), notified);
    return RemovalLogStatus.SUCCESS;
  }

  private boolean notifyRemoved(String sweepId, long memberId) {
    try {
      notifier.sendDirectMessage(memberId, messages.removalNotice());
      return true;
    } catch (NotificationException e) {
      log.warn("Sweep {}: removal notice to {} not delivered: {}", sweepId, memberId, e.getMessage());
      return false;
    }
  }
}
