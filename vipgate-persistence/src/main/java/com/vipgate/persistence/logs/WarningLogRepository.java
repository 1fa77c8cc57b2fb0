package com.vipgate.persistence.logs;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WarningLogRepository extends JpaRepository<WarningLogEntity, Long> {

  boolean existsBySubscriptionIdAndLeadDaysAndExpiresAtAndStatus(
      UUID subscriptionId, int leadDays, Instant expiresAt, String status);

  List<WarningLogEntity> findAllByOrderByIdDesc(Pageable page);
}
