package com.vipgate.persistence.logs;

import com.vipgate.application.ports.WarningLogStore;
import com.vipgate.domain.sweep.WarningLogEntry;
import com.vipgate.domain.sweep.WarningStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
public class JpaWarningLogStore implements WarningLogStore {

  private final WarningLogRepository logs;

  public JpaWarningLogStore(WarningLogRepository logs) {
    this.logs = logs;
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasSent(UUID subscriptionId, int leadDays, Instant expiresAt) {
    return logs.existsBySubscriptionIdAndLeadDaysAndExpiresAtAndStatus(
        subscriptionId, leadDays, expiresAt, WarningStatus.SENT.name());
  }

  @Override
  @Transactional
  public WarningLogEntry append(WarningLogEntry e) {
    return toEntry(logs.save(new WarningLogEntity(e.subscriptionId(), e.email(), e.memberId(), e.leadDays(),
        e.expiresAt(), e.status().name(), e.error(), e.createdAt())));
  }

  @Override
  @Transactional(readOnly = true)
  public List<WarningLogEntry> recent(int limit) {
    return logs.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit))).stream()
        .map(JpaWarningLogStore::toEntry)
        .toList();
  }

  private static WarningLogEntry toEntry(WarningLogEntity e) {
    return new WarningLogEntry(e.getId(), e.getSubscriptionId(), e.getEmail(), e.getMemberId(), e.getLeadDays(),
        e.getExpiresAt(), WarningStatus.valueOf(e.getStatus()), e.getError(), e.getCreatedAt());
  }
}
