package com.vipgate.api.admin;

import com.vipgate.application.access.AccessService;
import com.vipgate.application.access.UnlockResult;
import com.vipgate.domain.access.InviteLogEntry;
import com.vipgate.domain.model.Emails;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues invite links on behalf of a member (the "unlock access" flow).
 */
@RestController
@RequestMapping("/api/v1/admin/access")
public class AdminAccessController {

  private final AccessService access;
  private final AdminAuditService audit;

  public AdminAccessController(AccessService access, AdminAuditService audit) {
    this.access = access;
    this.audit = audit;
  }

  public record UnlockRequest(@NotBlank String email, String memberId) {}

  public record InviteRow(Long groupId, String link, int memberLimit, boolean temporary, String expiresAt) {
    static InviteRow of(InviteLogEntry e) {
      return new InviteRow(e.groupId(), e.inviteLink(), e.memberLimit(), e.temporary(),
          e.expiresAt() == null ? null : e.expiresAt().toString());
    }
  }

  @PostMapping("/unlock")
  public Map<String, Object> unlock(@Valid @RequestBody UnlockRequest req) {
    UnlockResult r = access.unlock(req.email(), req.memberId());
    if (r.outcome() == UnlockResult.Outcome.GRANTED) {
      audit.logAdmin("ACCESS_UNLOCK", "SUBSCRIPTION", Emails.normalize(req.email()),
          "invites=" + r.invites().size() + (r.reason() == null ? "" : " via=" + r.reason()));
    }

    List<InviteRow> invites = r.invites().stream().map(InviteRow::of).toList();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("outcome", r.outcome().name());
    body.put("reason", r.reason());
    body.put("invites", invites);
    return body;
  }
}
