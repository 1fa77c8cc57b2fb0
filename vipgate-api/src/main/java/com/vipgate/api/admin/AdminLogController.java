package com.vipgate.api.admin;

import com.vipgate.application.ports.RemovalLogStore;
import com.vipgate.application.ports.WarningLogStore;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.sweep.RemovalLogEntry;
import com.vipgate.domain.sweep.WarningLogEntry;
import com.vipgate.persistence.audit.AuditLogEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/logs")
public class AdminLogController {

  private final RemovalLogStore removals;
  private final WarningLogStore warnings;
  private final AdminAuditService audit;

  public AdminLogController(RemovalLogStore removals, WarningLogStore warnings, AdminAuditService audit) {
    this.removals = removals;
    this.warnings = warnings;
    this.audit = audit;
  }

  public record RemovalRow(
      Long id,
      String sweepId,
      String email,
      String memberId,
      String reason,
      String status,
      List<Long> groupsRemoved,
      List<Long> groupsFailed,
      boolean notified,
      String error,
      String createdAt
  ) {
    static RemovalRow of(RemovalLogEntry e) {
      return new RemovalRow(e.id(), e.sweepId(), e.email(), e.memberId(),
          e.reason() == null ? null : e.reason().name(), e.status().name(), e.groupsRemoved(), e.groupsFailed(),
          e.notified(), e.error(), e.createdAt().toString());
    }
  }

  public record WarningRow(
      Long id,
      String subscriptionId,
      String email,
      String memberId,
      int leadDays,
      String expiresAt,
      String status,
      String error,
      String createdAt
  ) {
    static WarningRow of(WarningLogEntry e) {
      return new WarningRow(e.id(), e.subscriptionId().toString(), e.email(), e.memberId(), e.leadDays(),
          e.expiresAt().toString(), e.status().name(), e.error(), e.createdAt().toString());
    }
  }

  @GetMapping("/removals")
  public List<RemovalRow> removals(@RequestParam(required = false) String email,
                                   @RequestParam(defaultValue = "100") int limit) {
    int size = clamp(limit);
    List<RemovalLogEntry> rows = email == null || email.isBlank()
        ? removals.recent(size)
        : removals.recentByEmail(Emails.normalize(email), size);
    return rows.stream().map(RemovalRow::of).toList();
  }

  @GetMapping("/warnings")
  public List<WarningRow> warnings(@RequestParam(defaultValue = "100") int limit) {
    return warnings.recent(clamp(limit)).stream().map(WarningRow::of).toList();
  }

  public record AuditRow(String actor, String action, String targetType, String targetId, String detail,
                         String requestId, String createdAt) {
    static AuditRow of(AuditLogEntity e) {
      return new AuditRow(e.getActor(), e.getAction(), e.getTargetType(), e.getTargetId(), e.getDetail(),
          e.getRequestId(), e.getCreatedAt().toString());
    }
  }

  @GetMapping("/audit")
  public List<AuditRow> audit(@RequestParam(defaultValue = "100") int limit) {
    return audit.recent(clamp(limit)).stream().map(AuditRow::of).toList();
  }

  private static int clamp(int limit) {
    return Math.max(1, Math.min(500, limit));
  }
}
