package com.vipgate.api.admin;

import com.vipgate.api.common.NotFoundException;
import com.vipgate.application.admin.ManualRemoval;
import com.vipgate.application.admin.SubscriptionAdminService;
import com.vipgate.application.admin.SubscriptionDraft;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/subscriptions")
public class AdminSubscriptionController {

  private final SubscriptionStore subscriptions;
  private final SubscriptionAdminService admin;
  private final AdminAuditService audit;

  public AdminSubscriptionController(SubscriptionStore subscriptions, SubscriptionAdminService admin,
                                     AdminAuditService audit) {
    this.subscriptions = subscriptions;
    this.admin = admin;
    this.audit = audit;
  }

  public record SubscriptionRow(
      String id,
      String email,
      String fullName,
      String memberId,
      String customerId,
      String billingSubscriptionId,
      String lastInvoiceId,
      String plan,
      String status,
      String expiresAt,
      String createdAt,
      String updatedAt
  ) {
    static SubscriptionRow of(SubscriptionRecord r) {
      return new SubscriptionRow(
          r.id().toString(),
          r.email(),
          r.fullName(),
          r.memberId(),
          r.customerId(),
          r.billingSubscriptionId(),
          r.lastInvoiceId(),
          r.plan().name(),
          r.status().name(),
          r.expiresAt() == null ? null : r.expiresAt().toString(),
          r.createdAt().toString(),
          r.updatedAt().toString()
      );
    }
  }

  public record UpsertRequest(
      String fullName,
      String memberId,
      String customerId,
      String billingSubscriptionId,
      String plan,
      @NotNull String status,
      Instant expiresAt
  ) {}

  public record LinkMemberRequest(@NotBlank String memberId) {}

  public record RemoveRequest(boolean removeFromGroups) {}

  @GetMapping
  public List<SubscriptionRow> list(@RequestParam(required = false) String status) {
    SubscriptionStatus filter = null;
    if (status != null && !status.isBlank()) {
      filter = SubscriptionStatus.parse(status)
          .orElseThrow(() -> new IllegalArgumentException("unknown status: " + status));
    }
    return subscriptions.findAll(filter).stream().map(SubscriptionRow::of).toList();
  }

  @GetMapping("/{email:.+}")
  public SubscriptionRow get(@PathVariable String email) {
    return subscriptions.findByEmail(Emails.normalize(email))
        .map(SubscriptionRow::of)
        .orElseThrow(() -> new NotFoundException("subscription not found"));
  }

  @PutMapping("/{email:.+}")
  public SubscriptionRow upsert(@PathVariable String email, @Valid @RequestBody UpsertRequest req) {
    SubscriptionStatus status = SubscriptionStatus.parse(req.status())
        .orElseThrow(() -> new IllegalArgumentException("unknown status: " + req.status()));
    PlanType plan = req.plan() == null || req.plan().isBlank() ? PlanType.UNKNOWN : PlanType.parse(req.plan());
    if (plan == PlanType.UNKNOWN && req.plan() != null && !req.plan().isBlank()
        && !"UNKNOWN".equalsIgnoreCase(req.plan().trim())) {
      throw new IllegalArgumentException("unknown plan: " + req.plan());
    }

    SubscriptionRecord saved = admin.upsert(new SubscriptionDraft(
        email, req.fullName(), req.memberId(), req.customerId(), req.billingSubscriptionId(), plan, status,
        req.expiresAt()));
    audit.logAdmin("SUBSCRIPTION_UPSERT", "SUBSCRIPTION", saved.email(),
        "status=" + saved.status() + " plan=" + saved.plan() + " expiresAt=" + saved.expiresAt());
    return SubscriptionRow.of(saved);
  }

  @DeleteMapping("/{email:.+}")
  public Map<String, Object> delete(@PathVariable String email) {
    if (!admin.delete(email)) throw new NotFoundException("subscription not found");
    audit.logAdmin("SUBSCRIPTION_DELETE", "SUBSCRIPTION", Emails.normalize(email));
    return Map.of("status", "ok", "email", Emails.normalize(email), "deleted", true);
  }

  @PostMapping("/{email:.+}/member")
  public SubscriptionRow linkMember(@PathVariable String email, @Valid @RequestBody LinkMemberRequest req) {
    SubscriptionRecord saved = admin.linkMember(email, req.memberId())
        .orElseThrow(() -> new NotFoundException("subscription not found"));
    audit.logAdmin("SUBSCRIPTION_LINK_MEMBER", "SUBSCRIPTION", saved.email(), "memberId=" + saved.memberId());
    return SubscriptionRow.of(saved);
  }

  @PostMapping("/{email:.+}/remove")
  public Map<String, Object> markRemoved(@PathVariable String email,
                                         @RequestBody(required = false) RemoveRequest req) {
    boolean fromGroups = req != null && req.removeFromGroups();
    ManualRemoval r = admin.markRemoved(email, fromGroups)
        .orElseThrow(() -> new NotFoundException("subscription not found"));
    audit.logAdmin(fromGroups ? "SUBSCRIPTION_REMOVE_AND_KICK" : "SUBSCRIPTION_REMOVE", "SUBSCRIPTION",
        r.record().email(),
        fromGroups ? "groupsRemoved=" + r.groupsRemoved() + " groupsFailed=" + r.groupsFailed() : null);
    return Map.of(
        "status", "ok",
        "subscription", SubscriptionRow.of(r.record()),
        "groupsRemoved", r.groupsRemoved(),
        "groupsFailed", r.groupsFailed()
    );
  }
}
