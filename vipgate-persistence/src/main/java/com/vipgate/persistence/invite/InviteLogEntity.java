package com.vipgate.persistence.invite;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invite_logs", indexes = @Index(name = "ix_invite_logs_email_created", columnList = "email,created_at"))
public class InviteLogEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "member_id", length = 64)
  private String memberId;

  // null for the static fallback link
  @Column(name = "group_id")
  private Long groupId;

  @Column(name = "invite_link", nullable = false, length = 500)
  private String inviteLink;

  @Column(name = "member_limit", nullable = false)
  private int memberLimit;

  @Column(name = "temporary_link", nullable = false)
  private boolean temporary;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected InviteLogEntity() {}

  public InviteLogEntity(UUID id, String email, String memberId, Long groupId, String inviteLink, int memberLimit,
                         boolean temporary, Instant expiresAt, Instant createdAt) {
    this.id = id;
    this.email = email;
    this.memberId = memberId;
    this.groupId = groupId;
    this.inviteLink = inviteLink;
    this.memberLimit = memberLimit;
    this.temporary = temporary;
    this.expiresAt = expiresAt;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getEmail() { return email; }
  public String getMemberId() { return memberId; }
  public Long getGroupId() { return groupId; }
  public String getInviteLink() { return inviteLink; }
  public int getMemberLimit() { return memberLimit; }
  public boolean isTemporary() { return temporary; }
  public Instant getExpiresAt() { return expiresAt; }
  public Instant getCreatedAt() { return createdAt; }
}
