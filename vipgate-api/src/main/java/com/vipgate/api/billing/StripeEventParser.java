package com.vipgate.api.billing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vipgate.domain.billing.BillingEvent;
import com.vipgate.domain.billing.CheckoutCompleted;
import com.vipgate.domain.billing.EventKind;
import com.vipgate.domain.billing.InvoicePaid;
import com.vipgate.domain.billing.SubscriptionDeleted;
import com.vipgate.domain.billing.SubscriptionUpdated;
import com.vipgate.domain.model.MemberIds;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps Stripe event JSON ({@code {id, type, data.object}}) onto reconciler events.
 *
 * Only the fields the reducer needs are read; everything else in the payload is ignored.
 * Expandable references (customer, subscription) may arrive as an id string or as an object.
 */
@Component
public class StripeEventParser {

  private final ObjectMapper mapper;

  public StripeEventParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * @throws IllegalArgumentException when the body is not a JSON object
   */
  public StripeEvent parse(String rawBody) {
    JsonNode root;
    try {
      root = mapper.readTree(rawBody == null ? "" : rawBody);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("invalid_payload", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("invalid_payload");
    }

    String id = readText(root, "id");
    String type = readText(root, "type");
    JsonNode obj = root.path("data").path("object");

    Optional<EventKind> kind = EventKind.fromProviderType(type);
    if (kind.isEmpty() || !obj.isObject()) {
      return new StripeEvent(id, type, Optional.empty());
    }

    BillingEvent event = switch (kind.get()) {
      case CHECKOUT_COMPLETED -> checkout(id, obj);
      case INVOICE_PAID -> invoice(id, obj);
      case SUBSCRIPTION_UPDATED -> new SubscriptionUpdated(id, readText(obj, "id"), ref(obj, "customer"),
          readText(obj, "status"));
      case SUBSCRIPTION_DELETED -> new SubscriptionDeleted(id, readText(obj, "id"), ref(obj, "customer"));
    };
    return new StripeEvent(id, type, Optional.of(event));
  }

  private static CheckoutCompleted checkout(String eventId, JsonNode s) {
    String email = readText(s, "customer_details", "email");
    if (email == null) email = readText(s, "customer_email");

    return new CheckoutCompleted(
        eventId,
        readText(s, "id"),
        email,
        readText(s, "customer_details", "name"),
        memberIdHint(s),
        ref(s, "customer"),
        ref(s, "subscription"),
        "paid".equals(readText(s, "payment_status")),
        "subscription".equals(readText(s, "mode"))
    );
  }

  private static InvoicePaid invoice(String eventId, JsonNode inv) {
    JsonNode line = inv.path("lines").path("data").path(0);

    String priceId = readText(line, "price", "id");
    if (priceId == null) priceId = readText(line, "pricing", "price_details", "price");

    String subscriptionId = ref(inv, "subscription");
    if (subscriptionId == null) subscriptionId = readText(inv, "parent", "subscription_details", "subscription");

    JsonNode end = line.path("period").path("end");
    Instant periodEnd = end.canConvertToLong() && end.asLong() > 0 ? Instant.ofEpochSecond(end.asLong()) : null;

    return new InvoicePaid(
        eventId,
        readText(inv, "id"),
        readText(inv, "customer_email"),
        ref(inv, "customer"),
        subscriptionId,
        priceId,
        periodEnd,
        readText(line, "description")
    );
  }

  /**
   * Telegram id from checkout custom fields (key or label mentioning "telegram", text before numeric),
   * then {@code metadata.telegram_id}. Digits only.
   */
  static String memberIdHint(JsonNode session) {
    for (JsonNode f : session.path("custom_fields")) {
      String key = lower(readText(f, "key"));
      String label = lower(readText(f, "label", "custom"));
      if (!key.contains("telegram") && !label.contains("telegram")) continue;

      String v = MemberIds.digitsOnly(readText(f, "text", "value"));
      if (v == null) v = MemberIds.digitsOnly(readText(f, "numeric", "value"));
      if (v != null) return v;
    }
    return MemberIds.digitsOnly(readText(session, "metadata", "telegram_id"));
  }

  private static String ref(JsonNode obj, String field) {
    JsonNode n = obj.get(field);
    if (n == null || n.isNull()) return null;
    if (n.isObject()) return readText(n, "id");
    String v = n.asText();
    return v.isBlank() ? null : v.trim();
  }

  private static String readText(JsonNode root, String... path) {
    JsonNode n = root;
    for (String p : path) {
      if (n == null) return null;
      n = n.get(p);
    }
    if (n == null || !n.isValueNode() || n.isNull()) return null;
    String v = n.asText();
    return v.isBlank() ? null : v.trim();
  }

  private static String lower(String v) {
    return v == null ? "" : v.toLowerCase(Locale.ROOT);
  }
}
