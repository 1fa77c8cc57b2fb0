package com.vipgate.persistence.events;

import com.vipgate.application.ports.ProcessedEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Deduplication backed by the processed_events primary key.
 * A concurrent insert of the same id is treated as "already recorded".
 */
@Component
public class JpaProcessedEventStore implements ProcessedEventStore {

  private static final Logger log = LoggerFactory.getLogger(JpaProcessedEventStore.class);

  private final ProcessedEventRepository events;

  public JpaProcessedEventStore(ProcessedEventRepository events) {
    this.events = events;
  }

  @Override
  @Transactional(readOnly = true)
  public boolean alreadyProcessed(String eventId) {
    return events.existsById(eventId);
  }

  @Override
  public void record(String eventId, String eventType, Instant receivedAt) {
    try {
      events.saveAndFlush(new ProcessedEventEntity(eventId, eventType, receivedAt));
    } catch (DataIntegrityViolationException dup) {
      log.debug("Event {} already recorded", eventId);
    }
  }

  @Override
  @Transactional
  public int purgeOlderThan(Instant cutoff) {
    return events.deleteReceivedBefore(cutoff);
  }
}
