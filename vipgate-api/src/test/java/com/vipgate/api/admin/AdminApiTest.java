package com.vipgate.api.admin;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.vipgate.api.security.JwtBeans;
import com.vipgate.persistence.audit.AuditLogEntity;
import com.vipgate.persistence.audit.AuditLogRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminApiTest {

  @Autowired MockMvc mvc;
  @Autowired AuditLogRepository auditLog;

  private static RequestPostProcessor admin() {
    return jwt().jwt(j -> j.subject("ops-alice")).authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
  }

  private static String uniqueEmail(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@mail.io";
  }

  @Test
  void adminEndpointsRequireAdminRole() throws Exception {
    mvc.perform(get("/api/v1/admin/subscriptions"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().exists("WWW-Authenticate"))
        .andExpect(jsonPath("$.reason").value("unauthorized"));

    mvc.perform(get("/api/v1/admin/subscriptions")
            .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_USER"))))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.reason").value("forbidden"));

    mvc.perform(get("/api/v1/admin/subscriptions").with(admin()))
        .andExpect(status().isOk());
  }

  @Test
  void realHs256TokenWithAdminRoleIsAccepted() throws Exception {
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject("ops-bob")
        .claim("role", "ADMIN")
        .issueTime(new Date())
        .expirationTime(Date.from(Instant.now().plusSeconds(600)))
        .build();
    SignedJWT token = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
    token.sign(new MACSigner(JwtBeans.deriveKey("test-secret")));

    mvc.perform(get("/api/v1/admin/sweep/status")
            .header("Authorization", "Bearer " + token.serialize()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(false));

    SignedJWT forged = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
    forged.sign(new MACSigner(JwtBeans.deriveKey("some-other-secret")));

    mvc.perform(get("/api/v1/admin/sweep/status")
            .header("Authorization", "Bearer " + forged.serialize()))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void subscriptionLifecycleIsAudited() throws Exception {
    String email = uniqueEmail("admin");

    mvc.perform(get("/api/v1/admin/subscriptions/" + email).with(admin()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.reason").value("not_found"));

    mvc.perform(put("/api/v1/admin/subscriptions/" + email.toUpperCase())
            .with(admin())
            .header("X-Request-Id", "req-upsert-1")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"fullName":"Ada Admin","plan":"quarterly","status":"active","expiresAt":"2030-01-01T00:00:00Z"}
                """))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "req-upsert-1"))
        .andExpect(jsonPath("$.email").value(email))
        .andExpect(jsonPath("$.plan").value("QUARTERLY"))
        .andExpect(jsonPath("$.status").value("ACTIVE"));

    mvc.perform(get("/api/v1/admin/subscriptions").param("status", "ACTIVE").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.email == '" + email + "')]").exists());

    mvc.perform(post("/api/v1/admin/subscriptions/" + email + "/member")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"memberId\":\"777001\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.memberId").value("777001"));

    mvc.perform(post("/api/v1/admin/subscriptions/" + email + "/remove").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subscription.status").value("MANUALLY_REMOVED"));

    mvc.perform(delete("/api/v1/admin/subscriptions/" + email).with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(true));

    mvc.perform(delete("/api/v1/admin/subscriptions/" + email).with(admin()))
        .andExpect(status().isNotFound());

    List<AuditLogEntity> rows = auditLog.findByTargetTypeAndTargetIdOrderByCreatedAtDesc("SUBSCRIPTION", email);
    assertThat(rows).extracting(AuditLogEntity::getAction)
        .contains("SUBSCRIPTION_UPSERT", "SUBSCRIPTION_LINK_MEMBER", "SUBSCRIPTION_REMOVE", "SUBSCRIPTION_DELETE");
    assertThat(rows).allSatisfy(r -> assertThat(r.getActor()).isEqualTo("ops-alice"));
    assertThat(rows).anySatisfy(r -> {
      assertThat(r.getAction()).isEqualTo("SUBSCRIPTION_UPSERT");
      assertThat(r.getRequestId()).isEqualTo("req-upsert-1");
      assertThat(r.getDetail()).contains("status=ACTIVE", "plan=QUARTERLY");
    });

    mvc.perform(get("/api/v1/admin/logs/audit").param("limit", "500").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.requestId == 'req-upsert-1')].action").value("SUBSCRIPTION_UPSERT"));
  }

  @Test
  void invalidInputAnswers400() throws Exception {
    String email = uniqueEmail("bad");

    mvc.perform(put("/api/v1/admin/subscriptions/" + email)
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"sleeping\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));

    mvc.perform(put("/api/v1/admin/subscriptions/" + email)
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"fullName\":\"No Status\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation_error"));

    mvc.perform(put("/api/v1/admin/subscriptions/not-an-email")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"ACTIVE\"}"))
        .andExpect(status().isBadRequest());

    mvc.perform(get("/api/v1/admin/subscriptions").param("status", "zombie").with(admin()))
        .andExpect(status().isBadRequest());

    mvc.perform(put("/api/v1/admin/subscriptions/" + email)
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("malformed_request"))
        .andExpect(jsonPath("$.status").value("error"));
  }

  @Test
  void whitelistAddListRemove() throws Exception {
    String memberId = String.valueOf(900_000 + (System.nanoTime() % 99_999));

    mvc.perform(post("/api/v1/admin/whitelist")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"memberId\":\"" + memberId + "\",\"email\":\"vip@mail.io\",\"reason\":\"partner\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.addedBy").value("ops-alice"));

    mvc.perform(get("/api/v1/admin/whitelist").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.memberId == '" + memberId + "')].reason").value("partner"));

    mvc.perform(post("/api/v1/admin/whitelist")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"memberId\":\"abc\"}"))
        .andExpect(status().isBadRequest());

    mvc.perform(delete("/api/v1/admin/whitelist/" + memberId).with(admin()))
        .andExpect(status().isOk());
    mvc.perform(delete("/api/v1/admin/whitelist/" + memberId).with(admin()))
        .andExpect(status().isNotFound());

    assertThat(auditLog.findByTargetTypeAndTargetIdOrderByCreatedAtDesc("MEMBER", memberId))
        .extracting(AuditLogEntity::getAction)
        .containsExactlyInAnyOrder("WHITELIST_REMOVE", "WHITELIST_ADD");
  }

  @Test
  void sweepAndWarningTriggers() throws Exception {
    mvc.perform(get("/api/v1/admin/sweep/preview").with(admin()))
        .andExpect(status().isOk());
    mvc.perform(get("/api/v1/admin/sweep/grace").with(admin()))
        .andExpect(status().isOk());

    mvc.perform(post("/api/v1/admin/sweep/run").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.run").value("COMPLETED"))
        .andExpect(jsonPath("$.report.sweepId").isNotEmpty());

    mvc.perform(get("/api/v1/admin/sweep/status").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lastCompletedAt").isNotEmpty());

    mvc.perform(post("/api/v1/admin/warnings/run").with(admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));

    mvc.perform(get("/api/v1/admin/logs/removals").param("limit", "10000").with(admin()))
        .andExpect(status().isOk());
    mvc.perform(get("/api/v1/admin/logs/warnings").with(admin()))
        .andExpect(status().isOk());
  }

  @Test
  void unlockDeniesUnknownAndReportsUnavailableWithoutTelegram() throws Exception {
    mvc.perform(post("/api/v1/admin/access/unlock")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"" + uniqueEmail("nobody") + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("DENIED"))
        .andExpect(jsonPath("$.reason").value("no_active_subscription"));

    String email = uniqueEmail("entitled");
    mvc.perform(put("/api/v1/admin/subscriptions/" + email)
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"ACTIVE\",\"memberId\":\"4242\"}"))
        .andExpect(status().isOk());

    mvc.perform(post("/api/v1/admin/access/unlock")
            .with(admin())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"" + email + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("UNAVAILABLE"))
        .andExpect(jsonPath("$.invites").isEmpty());

    assertThat(auditLog.findByTargetTypeAndTargetIdOrderByCreatedAtDesc("SUBSCRIPTION", email))
        .extracting(AuditLogEntity::getAction)
        .doesNotContain("ACCESS_UNLOCK");
  }
}
