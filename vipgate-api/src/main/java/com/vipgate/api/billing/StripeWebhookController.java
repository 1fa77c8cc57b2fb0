package com.vipgate.api.billing;

import com.vipgate.application.billing.BillingEventIngestor;
import com.vipgate.application.billing.IngestResult;
import com.vipgate.domain.billing.BillingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stripe webhook endpoint.
 *
 * Status codes drive Stripe's retry:
 * - 400 bad signature / unreadable payload (retrying will not help, but Stripe flags the endpoint)
 * - 500 storage failure (event not recorded, the re-delivery is processed again)
 * - 200 everything else, including duplicates and ignored events
 */
@RestController
@RequestMapping("/api/v1/billing/stripe")
public class StripeWebhookController {

  private static final Logger log = LoggerFactory.getLogger(StripeWebhookController.class);

  private final StripeSignatureVerifier signature;
  private final StripeEventParser parser;
  private final BillingEventIngestor ingestor;

  public StripeWebhookController(
      StripeSignatureVerifier signature,
      StripeEventParser parser,
      BillingEventIngestor ingestor
  ) {
    this.signature = signature;
    this.parser = parser;
    this.ingestor = ingestor;
  }

  @PostMapping("/webhook")
  public ResponseEntity<Map<String, Object>> webhook(
      @RequestHeader(value = "Stripe-Signature", required = false) String stripeSignature,
      @RequestBody String rawBody
  ) {
    if (!signature.verifyOrBypass(rawBody, stripeSignature)) {
      log.warn("Rejected Stripe webhook: invalid signature");
      return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
          "status", "error",
          "reason", "invalid_signature",
          "ts", Instant.now().toString()
      ));
    }

    StripeEvent parsed;
    try {
      parsed = parser.parse(rawBody);
    } catch (IllegalArgumentException e) {
      log.warn("Rejected Stripe webhook: unreadable payload");
      return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
          "status", "error",
          "reason", "invalid_payload",
          "ts", Instant.now().toString()
      ));
    }

    if (parsed.event().isEmpty()) {
      log.debug("Ignoring Stripe event type={} id={}", parsed.type(), parsed.id());
      return ResponseEntity.ok(body(parsed.id(), IngestResult.Outcome.IGNORED.name(), null, "unhandled_type"));
    }

    BillingEvent event = parsed.event().get();
    try {
      IngestResult r = ingestor.ingest(event, parsed.type());
      return ResponseEntity.ok(body(
          r.eventId(),
          r.outcome().name(),
          r.change() == null ? null : r.change().name(),
          r.reason()
      ));
    } catch (RuntimeException e) {
      log.error("Stripe event {} ({}) failed, Stripe will retry", parsed.id(), parsed.type(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
          "status", "error",
          "reason", "processing_failed",
          "eventId", parsed.id() == null ? "" : parsed.id(),
          "ts", Instant.now().toString()
      ));
    }
  }

  private static Map<String, Object> body(String eventId, String outcome, String change, String reason) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "ok");
    m.put("outcome", outcome);
    m.put("change", change);
    m.put("eventId", eventId);
    if (reason != null) m.put("reason", reason);
    return m;
  }
}
