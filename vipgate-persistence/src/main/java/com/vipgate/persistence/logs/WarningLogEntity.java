package com.vipgate.persistence.logs;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "expiry_warning_logs",
    indexes = @Index(name = "ix_warning_logs_milestone", columnList = "subscription_id,lead_days,expires_at")
)
public class WarningLogEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "subscription_id", nullable = false)
  private UUID subscriptionId;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "member_id", length = 64)
  private String memberId;

  @Column(name = "lead_days", nullable = false)
  private int leadDays;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "error", columnDefinition = "text")
  private String error;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected WarningLogEntity() {}

  public WarningLogEntity(UUID subscriptionId, String email, String memberId, int leadDays, Instant expiresAt,
                          String status, String error, Instant createdAt) {
    this.subscriptionId = subscriptionId;
    this.email = email;
    this.memberId = memberId;
    this.leadDays = leadDays;
    this.expiresAt = expiresAt;
    this.status = status;
    this.error = error;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public UUID getSubscriptionId() { return subscriptionId; }
  public String getEmail() { return email; }
  public String getMemberId() { return memberId; }
  public int getLeadDays() { return leadDays; }
  public Instant getExpiresAt() { return expiresAt; }
  public String getStatus() { return status; }
  public String getError() { return error; }
  public Instant getCreatedAt() { return createdAt; }
}
