package com.vipgate.application.admin;

import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.MembershipException;
import com.vipgate.application.ports.SubscriptionStore;
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

/**
 * Manual corrections made by an operator.
 *
 * Invalid input is rejected with {@link IllegalArgumentException}; an unknown email yields an empty result.
 */
public class SubscriptionAdminService {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionAdminService.class);

  private final SubscriptionStore subscriptions;
  private final MembershipDirectoryPort directory;
  private final ReconcilerSettings settings;
  private final Clock clock;

  public SubscriptionAdminService(
      SubscriptionStore subscriptions,
      MembershipDirectoryPort directory,
      ReconcilerSettings settings,
      Clock clock
  ) {
    this.subscriptions = subscriptions;
    this.directory = directory;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Creates the record or replaces its operator-editable fields. Identity, creation time and the
   * last invoice marker of an existing record are kept.
   */
  public SubscriptionRecord upsert(SubscriptionDraft draft) {
    String email = requireEmail(draft.email());
    if (draft.status() == null) throw new IllegalArgumentException("status is required");
    String memberId = optionalMemberId(draft.memberId());

    Instant now = clock.instant();
    SubscriptionRecord base = subscriptions.findByEmail(email)
        .orElseGet(() -> SubscriptionRecord.create(email, draft.status(), now));

    SubscriptionRecord updated = base
        .withFullName(blankToNull(draft.fullName()))
        .withMemberId(memberId)
        .withCustomerId(blankToNull(draft.customerId()))
        .withBillingSubscriptionId(blankToNull(draft.billingSubscriptionId()))
        .withPlan(draft.plan())
        .withStatus(draft.status())
        .withExpiresAt(draft.expiresAt())
        .withUpdatedAt(now);
    return subscriptions.save(updated);
  }

  public Optional<SubscriptionRecord> linkMember(String rawEmail, String rawMemberId) {
    String email = requireEmail(rawEmail);
    String memberId = optionalMemberId(rawMemberId);
    if (memberId == null) throw new IllegalArgumentException("memberId is required");

    return subscriptions.findByEmail(email)
        .map(r -> subscriptions.save(r.withMemberId(memberId).withUpdatedAt(clock.instant())));
  }

  /**
   * Sets MANUALLY_REMOVED so billing events other than a paid invoice leave the record alone.
   * With {@code fromGroups} the member is also removed from every managed group; per-group failures
   * are reported, not thrown.
   */
  public Optional<ManualRemoval> markRemoved(String rawEmail, boolean fromGroups) {
    String email = requireEmail(rawEmail);
    Optional<SubscriptionRecord> found = subscriptions.findByEmail(email);
    if (found.isEmpty()) return Optional.empty();
    SubscriptionRecord r = found.get();

    List<Long> removed = new ArrayList<>();
    List<Long> failed = new ArrayList<>();
    if (fromGroups) {
      if (!MemberIds.isValid(r.memberId())) {
        throw new IllegalArgumentException("record has no valid memberId");
      }
      long memberId = Long.parseLong(r.memberId().trim());
      for (Long groupId : settings.groupIds()) {
        try {
          directory.removeMember(groupId, memberId);
          removed.add(groupId);
        } catch (MembershipException e) {
          failed.add(groupId);
          log.warn("Manual removal of {} from group {} failed: {}", memberId, groupId, e.getMessage());
        }
      }
    }

    SubscriptionRecord saved = subscriptions.save(
        r.withStatus(SubscriptionStatus.MANUALLY_REMOVED).withUpdatedAt(clock.instant()));
    log.info("Subscription {} marked MANUALLY_REMOVED (groups removed={}, failed={})", email, removed, failed);
    return Optional.of(new ManualRemoval(saved, removed, failed));
  }

  public boolean delete(String rawEmail) {
    return subscriptions.deleteByEmail(requireEmail(rawEmail));
  }

  private static String requireEmail(String raw) {
    if (!Emails.looksValid(raw)) throw new IllegalArgumentException("invalid email");
    return Emails.normalize(raw);
  }

  private static String optionalMemberId(String raw) {
    if (!MemberIds.isPresent(raw)) return null;
    String v = raw.trim();
    if (!MemberIds.isValid(v)) throw new IllegalArgumentException("memberId must be a positive number");
    return v;
  }

  private static String blankToNull(String v) {
    return v == null || v.isBlank() ? null : v.trim();
  }
}
