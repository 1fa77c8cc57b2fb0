package com.vipgate.persistence.events;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Write-once marker: the primary key is the deduplication gate.
 */
@Entity
@Table(
    name = "processed_events",
    indexes = @Index(name = "ix_processed_events_received", columnList = "received_at")
)
public class ProcessedEventEntity implements Persistable<String> {

  @Id
  @Column(name = "event_id", nullable = false, length = 255)
  private String eventId;

  @Column(name = "event_type", nullable = false, length = 128)
  private String eventType;

  @Column(name = "received_at", nullable = false)
  private Instant receivedAt;

  protected ProcessedEventEntity() {}

  public ProcessedEventEntity(String eventId, String eventType, Instant receivedAt) {
    this.eventId = eventId;
    this.eventType = eventType;
    this.receivedAt = receivedAt;
  }

  @Override
  public String getId() { return eventId; }

  // Always insert; an existing id must surface as a key violation, not a silent merge.
  @Override
  public boolean isNew() { return true; }

  public String getEventType() { return eventType; }
  public Instant getReceivedAt() { return receivedAt; }
}
