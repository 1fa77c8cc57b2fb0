package com.vipgate.persistence.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "subscriptions",
    uniqueConstraints = @UniqueConstraint(name = "uk_subscriptions_email", columnNames = "email"),
    indexes = {
        @Index(name = "ix_subscriptions_billing_sub", columnList = "billing_subscription_id"),
        @Index(name = "ix_subscriptions_customer", columnList = "customer_id"),
        @Index(name = "ix_subscriptions_status_expires", columnList = "status,expires_at")
    }
)
public class SubscriptionEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "full_name", length = 200)
  private String fullName;

  @Column(name = "member_id", length = 64)
  private String memberId;

  @Column(name = "customer_id", length = 100)
  private String customerId;

  @Column(name = "billing_subscription_id", length = 100)
  private String billingSubscriptionId;

  @Column(name = "last_invoice_id", length = 100)
  private String lastInvoiceId;

  @Column(name = "plan", nullable = false, length = 20)
  private String plan;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  protected SubscriptionEntity() {}

  public SubscriptionEntity(UUID id, String email, Instant createdAt) {
    this.id = id;
    this.email = email;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getEmail() { return email; }
  public String getFullName() { return fullName; }
  public String getMemberId() { return memberId; }
  public String getCustomerId() { return customerId; }
  public String getBillingSubscriptionId() { return billingSubscriptionId; }
  public String getLastInvoiceId() { return lastInvoiceId; }
  public String getPlan() { return plan; }
  public String getStatus() { return status; }
  public Instant getExpiresAt() { return expiresAt; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }
  public Long getVersion() { return version; }

  public void setFullName(String fullName) { this.fullName = fullName; }
  public void setMemberId(String memberId) { this.memberId = memberId; }
  public void setCustomerId(String customerId) { this.customerId = customerId; }
  public void setBillingSubscriptionId(String billingSubscriptionId) { this.billingSubscriptionId = billingSubscriptionId; }
  public void setLastInvoiceId(String lastInvoiceId) { this.lastInvoiceId = lastInvoiceId; }
  public void setPlan(String plan) { this.plan = plan; }
  public void setStatus(String status) { this.status = status; }
  public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
