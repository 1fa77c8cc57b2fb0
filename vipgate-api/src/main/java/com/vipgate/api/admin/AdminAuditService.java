package com.vipgate.api.admin;

import com.vipgate.api.security.SecurityActor;
import com.vipgate.api.tracing.RequestContext;
import com.vipgate.persistence.audit.AuditLogEntity;
import com.vipgate.persistence.audit.AuditLogRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes one audit row per admin mutation, tagged with the acting token subject and the request id.
 */
@Service
public class AdminAuditService {

  static final int MAX_DETAIL = 512;

  private final AuditLogRepository audits;
  private final Clock clock;

  public AdminAuditService(AuditLogRepository audits, Clock clock) {
    this.audits = audits;
    this.clock = clock;
  }

  public void logAdmin(String action, String targetType, String targetId) {
    logAdmin(action, targetType, targetId, null);
  }

  public void logAdmin(String action, String targetType, String targetId, String detail) {
    audits.save(new AuditLogEntity(
        UUID.randomUUID(),
        SecurityActor.current(),
        action,
        targetType,
        targetId == null ? "-" : targetId,
        truncate(detail),
        RequestContext.requestId(),
        clock.instant()
    ));
  }

  public List<AuditLogEntity> recent(int limit) {
    return audits.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
  }

  private static String truncate(String detail) {
    if (detail == null || detail.isBlank()) return null;
    return detail.length() <= MAX_DETAIL ? detail : detail.substring(0, MAX_DETAIL);
  }
}
