package com.vipgate.application.access;

import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.ports.InviteHandle;
import com.vipgate.application.ports.InviteLogStore;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.MembershipException;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.domain.access.InviteLogEntry;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.MemberIds;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues group invites to entitled members.
 *
 * Entitled: ACTIVE and not expired (no expiry counts as not expired).
 * Invites are single-use and short-lived, one per managed group. Within the cooldown the
 * previously issued links are returned instead of creating new ones.
 */
public class AccessService {

  private static final Logger log = LoggerFactory.getLogger(AccessService.class);

  private final SubscriptionStore subscriptions;
  private final InviteLogStore inviteLog;
  private final MembershipDirectoryPort directory;
  private final ReconcilerSettings settings;
  private final Clock clock;

  public AccessService(
      SubscriptionStore subscriptions,
      InviteLogStore inviteLog,
      MembershipDirectoryPort directory,
      ReconcilerSettings settings,
      Clock clock
  ) {
    this.subscriptions = subscriptions;
    this.inviteLog = inviteLog;
    this.directory = directory;
    this.settings = settings;
    this.clock = clock;
  }

  public UnlockResult unlock(String rawEmail, String memberIdHint) {
    String email = Emails.normalize(rawEmail);
    if (email == null || !Emails.looksValid(email)) {
      return UnlockResult.denied("invalid_email");
    }

    Instant now = clock.instant();
    Optional<SubscriptionRecord> found = subscriptions.findByEmail(email);
    if (found.isEmpty() || !isEntitled(found.get(), now)) {
      log.info("Unlock denied for {}: no active subscription", email);
      return UnlockResult.denied("no_active_subscription");
    }
    SubscriptionRecord rec = found.get();

    String hint = MemberIds.digitsOnly(memberIdHint);
    if (!rec.hasMemberId() && hint != null) {
      rec = subscriptions.save(rec.withMemberId(hint).withUpdatedAt(now));
      log.info("Linked member id {} to {}", hint, email);
    }

    if (!settings.inviteCooldown().isZero()) {
      List<InviteLogEntry> recent = inviteLog.findIssuedSince(email, now.minus(settings.inviteCooldown()));
      if (!recent.isEmpty()) {
        return new UnlockResult(UnlockResult.Outcome.COOLDOWN, recent, "cooldown");
      }
    }

    List<InviteLogEntry> issued = new ArrayList<>();
    for (Long groupId : settings.groupIds()) {
      try {
        InviteHandle h = directory.createInvite(groupId, settings.inviteTtl(), 1);
        Instant expiresAt = h.expiresAt() != null ? h.expiresAt() : now.plus(settings.inviteTtl());
        issued.add(inviteLog.append(new InviteLogEntry(UUID.randomUUID(), email, rec.memberId(), groupId, h.link(),
            h.memberLimit(), true, expiresAt, now)));
      } catch (MembershipException e) {
        log.warn("Invite for {} in group {} failed: {}", email, groupId, e.getMessage());
      }
    }

    if (!issued.isEmpty()) {
      log.info("Issued {} invite(s) for {}", issued.size(), email);
      return new UnlockResult(UnlockResult.Outcome.GRANTED, issued, null);
    }

    if (settings.hasFallbackInvite()) {
      InviteLogEntry fallback = inviteLog.append(new InviteLogEntry(UUID.randomUUID(), email, rec.memberId(), null,
          settings.fallbackInviteLink(), 0, false, null, now));
      log.warn("No group invite could be created for {}, returning fallback link", email);
      return new UnlockResult(UnlockResult.Outcome.GRANTED, List.of(fallback), "fallback");
    }

    log.error("No invite could be created for {} and no fallback link configured", email);
    return new UnlockResult(UnlockResult.Outcome.UNAVAILABLE, List.of(), "invite_unavailable");
  }

  public static boolean isEntitled(SubscriptionRecord r, Instant now) {
    return r.status() == SubscriptionStatus.ACTIVE && (r.expiresAt() == null || r.expiresAt().isAfter(now));
  }
}
