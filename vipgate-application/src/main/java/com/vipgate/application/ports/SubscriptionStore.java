package com.vipgate.application.ports;

import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable subscription state, keyed by normalized email.
 *
 * Single writer: implementations reject a save whose record was changed concurrently rather than
 * silently overwriting it.
 */
public interface SubscriptionStore {

  Optional<SubscriptionRecord> findByEmail(String email);

  Optional<SubscriptionRecord> findById(UUID id);

  Optional<SubscriptionRecord> findByBillingSubscriptionId(String billingSubscriptionId);

  Optional<SubscriptionRecord> findByCustomerId(String customerId);

  /**
   * Inserts or updates by email. Returns the stored record.
   */
  SubscriptionRecord save(SubscriptionRecord record);

  /**
   * ACTIVE or CANCELED records whose expiry is strictly before {@code cutoff}, plus CANCELED records
   * without an expiry.
   */
  List<SubscriptionRecord> findRemovalCandidates(Instant cutoff);

  /**
   * ACTIVE records with {@code fromInclusive <= expiresAt < toExclusive}.
   */
  List<SubscriptionRecord> findActiveExpiringBetween(Instant fromInclusive, Instant toExclusive);

  /**
   * All records, or only those with the given status when it is not null. Newest first.
   */
  List<SubscriptionRecord> findAll(SubscriptionStatus status);

  boolean deleteByEmail(String email);
}
