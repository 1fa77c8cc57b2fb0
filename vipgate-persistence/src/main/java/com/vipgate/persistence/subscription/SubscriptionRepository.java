package com.vipgate.persistence.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

  Optional<SubscriptionEntity> findByEmail(String email);

  Optional<SubscriptionEntity> findFirstByBillingSubscriptionIdOrderByUpdatedAtDesc(String billingSubscriptionId);

  Optional<SubscriptionEntity> findFirstByCustomerIdOrderByUpdatedAtDesc(String customerId);

  @Query("""
      select s from SubscriptionEntity s
      where (s.status = 'CANCELED' and (s.expiresAt is null or s.expiresAt < :cutoff))
         or (s.status = 'ACTIVE' and s.expiresAt is not null and s.expiresAt < :cutoff)
      order by s.expiresAt asc
      """)
  List<SubscriptionEntity> findRemovalCandidates(@Param("cutoff") Instant cutoff);

  @Query("""
      select s from SubscriptionEntity s
      where s.status = 'ACTIVE' and s.expiresAt >= :from and s.expiresAt < :to
      order by s.expiresAt asc
      """)
  List<SubscriptionEntity> findActiveExpiringBetween(@Param("from") Instant from, @Param("to") Instant to);

  List<SubscriptionEntity> findAllByOrderByUpdatedAtDesc();

  List<SubscriptionEntity> findByStatusOrderByUpdatedAtDesc(String status);

  long deleteByEmail(String email);
}
