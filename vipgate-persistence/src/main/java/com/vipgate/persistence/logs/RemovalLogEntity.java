package com.vipgate.persistence.logs;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
    name = "removal_logs",
    indexes = {
        @Index(name = "ix_removal_logs_email", columnList = "email"),
        @Index(name = "ix_removal_logs_sweep", columnList = "sweep_id"),
        @Index(name = "ix_removal_logs_created", columnList = "created_at")
    }
)
public class RemovalLogEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "sweep_id", length = 64)
  private String sweepId;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "member_id", length = 64)
  private String memberId;

  @Column(name = "reason", nullable = false, length = 20)
  private String reason;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  // comma separated group ids
  @Column(name = "groups_removed", length = 1000)
  private String groupsRemoved;

  @Column(name = "groups_failed", length = 1000)
  private String groupsFailed;

  @Column(name = "notified", nullable = false)
  private boolean notified;

  @Column(name = "error", columnDefinition = "text")
  private String error;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected RemovalLogEntity() {}

  public RemovalLogEntity(String sweepId, String email, String memberId, String reason, String status,
                          String groupsRemoved, String groupsFailed, boolean notified, String error, Instant createdAt) {
    this.sweepId = sweepId;
    this.email = email;
    this.memberId = memberId;
    this.reason = reason;
    this.status = status;
    this.groupsRemoved = groupsRemoved;
    this.groupsFailed = groupsFailed;
    this.notified = notified;
    this.error = error;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getSweepId() { return sweepId; }
  public String getEmail() { return email; }
  public String getMemberId() { return memberId; }
  public String getReason() { return reason; }
  public String getStatus() { return status; }
  public String getGroupsRemoved() { return groupsRemoved; }
  public String getGroupsFailed() { return groupsFailed; }
  public boolean isNotified() { return notified; }
  public String getError() { return error; }
  public Instant getCreatedAt() { return createdAt; }
}
