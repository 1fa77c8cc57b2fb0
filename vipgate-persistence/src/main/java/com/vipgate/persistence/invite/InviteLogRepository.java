package com.vipgate.persistence.invite;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface InviteLogRepository extends JpaRepository<InviteLogEntity, UUID> {

  List<InviteLogEntity> findByEmailAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(String email, Instant since);
}
