package com.vipgate.application.billing;

import com.vipgate.application.ReconcilerObserver;
import com.vipgate.application.ports.ProcessedEventStore;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.domain.billing.BillingEvent;
import com.vipgate.domain.billing.ChangeKind;
import com.vipgate.domain.billing.CheckoutCompleted;
import com.vipgate.domain.billing.EventReducer;
import com.vipgate.domain.billing.InvoicePaid;
import com.vipgate.domain.billing.PlanResolution;
import com.vipgate.domain.billing.Reduction;
import com.vipgate.domain.billing.SubscriptionDeleted;
import com.vipgate.domain.billing.SubscriptionUpdated;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.SubscriptionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies billing events to the subscription store exactly once per event id.
 *
 * Order per event:
 * - dedup check (a storage error here propagates: the caller must answer with a retryable failure)
 * - resolve the target record, reduce, persist when the record changed
 * - record the event id, only after the write succeeded
 *
 * A crash between the write and the record re-applies the event on redelivery; the reducer is a
 * fixed point for that case.
 */
public class BillingEventIngestor {

  private static final Logger log = LoggerFactory.getLogger(BillingEventIngestor.class);

  private final ProcessedEventStore processed;
  private final SubscriptionStore subscriptions;
  private final EventReducer reducer;
  private final Clock clock;
  private final ReconcilerObserver observer;

  public BillingEventIngestor(
      ProcessedEventStore processed,
      SubscriptionStore subscriptions,
      EventReducer reducer,
      Clock clock,
      ReconcilerObserver observer
  ) {
    this.processed = processed;
    this.subscriptions = subscriptions;
    this.reducer = reducer;
    this.clock = clock;
    this.observer = observer == null ? ReconcilerObserver.NOOP : observer;
  }

  /**
   * @param providerType raw provider event type, stored with the processed id
   */
  public IngestResult ingest(BillingEvent event, String providerType) {
    String eventId = event.eventId();
    if (eventId == null || eventId.isBlank()) {
      log.warn("Dropping {} event without id", event.kind());
      observer.onEventIgnored(event.kind(), "missing_event_id");
      return IngestResult.ignored(eventId, "missing_event_id");
    }

    if (processed.alreadyProcessed(eventId)) {
      log.debug("Duplicate event {} ({})", eventId, providerType);
      observer.onEventDuplicate(event.kind());
      return IngestResult.duplicate(eventId);
    }

    Instant now = clock.instant();
    SubscriptionRecord current = resolveTarget(event).orElse(null);
    Reduction r = reducer.reduce(current, event, now);

    if (r.planSource() == PlanResolution.Source.DESCRIPTION_HEURISTIC) {
      log.warn("Plan for event {} inferred from line description, price id not mapped", eventId);
    }

    if (r.change().mutates()) {
      subscriptions.save(r.record());
    }

    processed.record(eventId, providerType == null ? event.kind().name() : providerType, now);

    if (r.change() == ChangeKind.IGNORED) {
      log.warn("Ignored event {} ({}): {}", eventId, providerType, r.reason());
      observer.onEventIgnored(event.kind(), r.reason());
      return IngestResult.ignored(eventId, r.change(), r.reason());
    }

    SubscriptionRecord rec = r.record();
    log.info("Event {} ({}) -> {} email={} status={} expiresAt={}",
        eventId, providerType, r.change(), rec.email(), rec.status(), rec.expiresAt());
    observer.onEventApplied(event.kind(), r.change());
    return new IngestResult(eventId, IngestResult.Outcome.APPLIED, r.change(), r.reason());
  }

  private Optional<SubscriptionRecord> resolveTarget(BillingEvent event) {
    if (event instanceof CheckoutCompleted c) {
      return byEmail(c.email());
    }
    if (event instanceof InvoicePaid i) {
      return byEmail(i.email())
          .or(() -> byBillingIds(i.subscriptionId(), i.customerId()));
    }
    if (event instanceof SubscriptionUpdated u) {
      return byBillingIds(u.subscriptionId(), u.customerId());
    }
    if (event instanceof SubscriptionDeleted d) {
      return byBillingIds(d.subscriptionId(), d.customerId());
    }
    return Optional.empty();
  }

  private Optional<SubscriptionRecord> byEmail(String raw) {
    String email = Emails.normalize(raw);
    return email == null ? Optional.empty() : subscriptions.findByEmail(email);
  }

  private Optional<SubscriptionRecord> byBillingIds(String subscriptionId, String customerId) {
    Optional<SubscriptionRecord> bySub = isBlank(subscriptionId)
        ? Optional.empty()
        : subscriptions.findByBillingSubscriptionId(subscriptionId.trim());
    if (bySub.isPresent() || isBlank(customerId)) return bySub;
    return subscriptions.findByCustomerId(customerId.trim());
  }

  private static boolean isBlank(String v) {
    return v == null || v.isBlank();
  }
}
