package com.vipgate.persistence.subscription;

import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: subscription rows as domain records.
 *
 * Save rules:
 * - version null: insert (the unique email constraint rejects a concurrent duplicate)
 * - version set: update only if the row is still at that version, otherwise fail
 */
@Component
public class JpaSubscriptionStore implements SubscriptionStore {

  private final SubscriptionRepository subscriptions;

  public JpaSubscriptionStore(SubscriptionRepository subscriptions) {
    this.subscriptions = subscriptions;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<SubscriptionRecord> findByEmail(String email) {
    return subscriptions.findByEmail(email).map(JpaSubscriptionStore::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<SubscriptionRecord> findById(UUID id) {
    return subscriptions.findById(id).map(JpaSubscriptionStore::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<SubscriptionRecord> findByBillingSubscriptionId(String billingSubscriptionId) {
    return subscriptions.findFirstByBillingSubscriptionIdOrderByUpdatedAtDesc(billingSubscriptionId)
        .map(JpaSubscriptionStore::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<SubscriptionRecord> findByCustomerId(String customerId) {
    return subscriptions.findFirstByCustomerIdOrderByUpdatedAtDesc(customerId).map(JpaSubscriptionStore::toRecord);
  }

  @Override
  @Transactional
  public SubscriptionRecord save(SubscriptionRecord r) {
    SubscriptionEntity e;
    if (r.version() == null) {
      e = new SubscriptionEntity(r.id(), r.email(), r.createdAt());
    } else {
      e = subscriptions.findById(r.id())
          .orElseThrow(() -> new ObjectOptimisticLockingFailureException(SubscriptionEntity.class, r.id()));
      if (!Objects.equals(e.getVersion(), r.version())) {
        throw new ObjectOptimisticLockingFailureException(SubscriptionEntity.class, r.id());
      }
    }

    e.setFullName(r.fullName());
    e.setMemberId(r.memberId());
    e.setCustomerId(r.customerId());
    e.setBillingSubscriptionId(r.billingSubscriptionId());
    e.setLastInvoiceId(r.lastInvoiceId());
    e.setPlan(r.plan().name());
    e.setStatus(r.status().name());
    e.setExpiresAt(r.expiresAt());
    e.setUpdatedAt(r.updatedAt());

    return toRecord(subscriptions.saveAndFlush(e));
  }

  @Override
  @Transactional(readOnly = true)
  public List<SubscriptionRecord> findRemovalCandidates(Instant cutoff) {
    return subscriptions.findRemovalCandidates(cutoff).stream().map(JpaSubscriptionStore::toRecord).toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<SubscriptionRecord> findActiveExpiringBetween(Instant fromInclusive, Instant toExclusive) {
    return subscriptions.findActiveExpiringBetween(fromInclusive, toExclusive).stream()
        .map(JpaSubscriptionStore::toRecord)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<SubscriptionRecord> findAll(SubscriptionStatus status) {
    List<SubscriptionEntity> rows = status == null
        ? subscriptions.findAllByOrderByUpdatedAtDesc()
        : subscriptions.findByStatusOrderByUpdatedAtDesc(status.name());
    return rows.stream().map(JpaSubscriptionStore::toRecord).toList();
  }

  @Override
  @Transactional
  public boolean deleteByEmail(String email) {
    return subscriptions.deleteByEmail(email) > 0;
  }

  static SubscriptionRecord toRecord(SubscriptionEntity e) {
    return new SubscriptionRecord(
        e.getId(),
        e.getEmail(),
        e.getFullName(),
        e.getMemberId(),
        e.getCustomerId(),
        e.getBillingSubscriptionId(),
        e.getLastInvoiceId(),
        PlanType.parse(e.getPlan()),
        SubscriptionStatus.parse(e.getStatus()).orElse(SubscriptionStatus.PENDING),
        e.getExpiresAt(),
        e.getCreatedAt(),
        e.getUpdatedAt(),
        e.getVersion()
    );
  }
}
