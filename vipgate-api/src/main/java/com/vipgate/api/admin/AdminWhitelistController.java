package com.vipgate.api.admin;

import com.vipgate.api.common.NotFoundException;
import com.vipgate.api.security.SecurityActor;
import com.vipgate.application.ports.WhitelistStore;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.MemberIds;
import com.vipgate.domain.model.WhitelistEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Members exempt from automatic removal.
 */
@RestController
@RequestMapping("/api/v1/admin/whitelist")
public class AdminWhitelistController {

  private final WhitelistStore whitelist;
  private final AdminAuditService audit;
  private final Clock clock;

  public AdminWhitelistController(WhitelistStore whitelist, AdminAuditService audit, Clock clock) {
    this.whitelist = whitelist;
    this.audit = audit;
    this.clock = clock;
  }

  public record WhitelistRow(String memberId, String email, String reason, String addedBy, String createdAt) {
    static WhitelistRow of(WhitelistEntry e) {
      return new WhitelistRow(e.memberId(), e.email(), e.reason(), e.addedBy(),
          e.createdAt() == null ? null : e.createdAt().toString());
    }
  }

  public record AddRequest(@NotBlank String memberId, String email, String reason) {}

  @GetMapping
  public List<WhitelistRow> list() {
    return whitelist.findAll().stream().map(WhitelistRow::of).toList();
  }

  @PostMapping
  public WhitelistRow add(@Valid @RequestBody AddRequest req) {
    String memberId = req.memberId().trim();
    if (!MemberIds.isValid(memberId)) {
      throw new IllegalArgumentException("memberId must be a positive number");
    }
    if (req.email() != null && !req.email().isBlank() && !Emails.looksValid(req.email())) {
      throw new IllegalArgumentException("invalid email");
    }

    WhitelistEntry saved = whitelist.save(new WhitelistEntry(
        memberId,
        req.email(),
        req.reason(),
        SecurityActor.current(),
        clock.instant()
    ));
    audit.logAdmin("WHITELIST_ADD", "MEMBER", saved.memberId(), saved.reason());
    return WhitelistRow.of(saved);
  }

  @DeleteMapping("/{memberId}")
  public Map<String, Object> remove(@PathVariable String memberId) {
    if (!whitelist.delete(memberId.trim())) throw new NotFoundException("whitelist entry not found");
    audit.logAdmin("WHITELIST_REMOVE", "MEMBER", memberId.trim());
    return Map.of("status", "ok", "memberId", memberId.trim(), "deleted", true);
  }
}
