package com.vipgate.persistence.whitelist;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "whitelist", indexes = @Index(name = "ix_whitelist_email", columnList = "email"))
public class WhitelistEntity {

  @Id
  @Column(name = "member_id", nullable = false, length = 64)
  private String memberId;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "reason", length = 500)
  private String reason;

  @Column(name = "added_by", length = 128)
  private String addedBy;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected WhitelistEntity() {}

  public WhitelistEntity(String memberId, String email, String reason, String addedBy, Instant createdAt) {
    this.memberId = memberId;
    this.email = email;
    this.reason = reason;
    this.addedBy = addedBy;
    this.createdAt = createdAt;
  }

  public String getMemberId() { return memberId; }
  public String getEmail() { return email; }
  public String getReason() { return reason; }
  public String getAddedBy() { return addedBy; }
  public Instant getCreatedAt() { return createdAt; }
}
