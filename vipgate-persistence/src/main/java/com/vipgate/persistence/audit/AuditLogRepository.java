package com.vipgate.persistence.audit;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

  List<AuditLogEntity> findByTargetTypeAndTargetIdOrderByCreatedAtDesc(String targetType, String targetId);

  List<AuditLogEntity> findAllByOrderByCreatedAtDesc(Pageable page);
}
