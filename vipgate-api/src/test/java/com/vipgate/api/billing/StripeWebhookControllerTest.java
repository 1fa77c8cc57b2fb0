package com.vipgate.api.billing;

import com.vipgate.application.ports.ProcessedEventStore;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.domain.model.PlanType;
import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.model.SubscriptionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StripeWebhookControllerTest {

  private static final String SECRET = "whsec_test";
  private static final String URL = "/api/v1/billing/stripe/webhook";

  @Autowired MockMvc mvc;
  @Autowired SubscriptionStore subscriptions;
  @Autowired ProcessedEventStore processedEvents;

  private ResultActions postSigned(String body) throws Exception {
    long t = Instant.now().getEpochSecond();
    return mvc.perform(post(URL)
        .contentType(MediaType.APPLICATION_JSON)
        .header("Stripe-Signature", "t=" + t + ",v1=" + StripeSignatureVerifier.sign(SECRET, t + "." + body))
        .content(body));
  }

  private static String checkout(String eventId, String email, String sub, String cus) {
    return """
        {"id":"%s","type":"checkout.session.completed","data":{"object":{
          "id":"cs_%s","mode":"subscription","payment_status":"paid","customer":"%s","subscription":"%s",
          "customer_details":{"email":"%s","name":"Flow Tester"},
          "custom_fields":[{"key":"telegram","label":{"custom":"Telegram ID"},"text":{"value":"5551"}}]
        }}}
        """.formatted(eventId, eventId, cus, sub, email);
  }

  private static String invoice(String eventId, String email, String sub, String cus) {
    return """
        {"id":"%s","type":"invoice.paid","data":{"object":{
          "id":"in_%s","customer_email":"%s","customer":"%s","subscription":"%s",
          "lines":{"data":[{"description":"VIP monthly","price":{"id":"price_month"}}]}
        }}}
        """.formatted(eventId, eventId, email, cus, sub);
  }

  @Test
  void checkoutThenInvoiceThenCancellation() throws Exception {
    String key = UUID.randomUUID().toString().substring(0, 8);
    String email = "flow-" + key + "@mail.io";
    String sub = "sub_" + key;
    String cus = "cus_" + key;

    postSigned(checkout("evt_co_" + key, email, sub, cus))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("APPLIED"))
        .andExpect(jsonPath("$.change").value("CREATED"));

    Instant before = Instant.now();
    postSigned(invoice("evt_in_" + key, email, sub, cus))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.change").value("EXTENDED"));

    SubscriptionRecord r = subscriptions.findByEmail(email).orElseThrow();
    assertThat(r.status()).isEqualTo(SubscriptionStatus.ACTIVE);
    assertThat(r.memberId()).isEqualTo("5551");
    assertThat(r.plan()).isEqualTo(PlanType.MONTHLY);
    assertThat(r.lastInvoiceId()).isEqualTo("in_evt_in_" + key);
    assertThat(r.expiresAt()).isAfterOrEqualTo(before.plus(Duration.ofDays(30)));

    String deleted = """
        {"id":"evt_del_%s","type":"customer.subscription.deleted","data":{"object":{"id":"%s","customer":"%s"}}}
        """.formatted(key, sub, cus);
    postSigned(deleted)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.change").value("DEACTIVATED"));

    assertThat(subscriptions.findByEmail(email).orElseThrow().status()).isEqualTo(SubscriptionStatus.CANCELED);
  }

  @Test
  void redeliveryIsAcknowledgedAsDuplicate() throws Exception {
    String key = UUID.randomUUID().toString().substring(0, 8);
    String body = invoice("evt_dup_" + key, "dup-" + key + "@mail.io", "sub_d" + key, "cus_d" + key);

    postSigned(body).andExpect(jsonPath("$.outcome").value("APPLIED"));
    Instant expiry = subscriptions.findByEmail("dup-" + key + "@mail.io").orElseThrow().expiresAt();

    postSigned(body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("DUPLICATE"));

    assertThat(subscriptions.findByEmail("dup-" + key + "@mail.io").orElseThrow().expiresAt()).isEqualTo(expiry);
  }

  @Test
  void badSignatureIsRejectedAndNothingIsRecorded() throws Exception {
    String body = invoice("evt_forged", "forged@mail.io", "sub_f", "cus_f");

    mvc.perform(post(URL)
            .contentType(MediaType.APPLICATION_JSON)
            .header("Stripe-Signature", "t=" + Instant.now().getEpochSecond() + ",v1=00ff")
            .content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("invalid_signature"));

    mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest());

    assertThat(processedEvents.alreadyProcessed("evt_forged")).isFalse();
    assertThat(subscriptions.findByEmail("forged@mail.io")).isEmpty();
  }

  @Test
  void unhandledTypesAndMalformedPayloads() throws Exception {
    postSigned("{\"id\":\"evt_refund\",\"type\":\"charge.refunded\",\"data\":{\"object\":{\"id\":\"ch_1\"}}}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("IGNORED"))
        .andExpect(jsonPath("$.reason").value("unhandled_type"));

    postSigned("{not json")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("invalid_payload"));
  }

  @Test
  void statusEventForUnknownSubscriptionIsIgnoredButRecorded() throws Exception {
    String body = """
        {"id":"evt_orphan","type":"customer.subscription.updated","data":{"object":{"id":"sub_nobody","customer":"cus_nobody","status":"active"}}}
        """;

    postSigned(body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("IGNORED"))
        .andExpect(jsonPath("$.reason").value("unknown_subscription"));

    assertThat(processedEvents.alreadyProcessed("evt_orphan")).isTrue();
  }
}
