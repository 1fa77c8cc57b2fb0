package com.vipgate.api.billing;

import com.vipgate.api.config.BillingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies the Stripe-Signature header:
 * {@code t=<unix seconds>,v1=<hex(HMAC_SHA256(secret, t + "." + rawBody))>[,v1=...]}.
 *
 * Any matching v1 entry is accepted (Stripe sends several while a secret is being rolled).
 * The timestamp must be within the configured tolerance of the local clock.
 */
@Component
public class StripeSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(StripeSignatureVerifier.class);

  private final String webhookSecret;
  private final long toleranceSeconds;
  private final Clock clock;

  public StripeSignatureVerifier(BillingProperties billing, Clock clock) {
    this.webhookSecret = billing.webhookSecret() == null ? "" : billing.webhookSecret().trim();
    this.toleranceSeconds = billing.signatureToleranceSeconds();
    this.clock = clock;
    if (webhookSecret.isEmpty()) {
      log.warn("vipgate.billing.webhook-secret is empty: Stripe signatures are NOT verified");
    }
  }

  public boolean verifyOrBypass(String rawBody, String header) {
    if (webhookSecret.isEmpty()) {
      log.warn("Accepting unsigned webhook (no secret configured)");
      return true;
    }
    if (header == null || header.isBlank()) return false;

    Long timestamp = null;
    List<String> signatures = new ArrayList<>();
    for (String part : header.split(",")) {
      int eq = part.indexOf('=');
      if (eq <= 0) continue;
      String k = part.substring(0, eq).trim();
      String v = part.substring(eq + 1).trim();
      if ("t".equals(k)) {
        try {
          timestamp = Long.parseLong(v);
        } catch (NumberFormatException e) {
          return false;
        }
      } else if ("v1".equals(k) && !v.isEmpty()) {
        signatures.add(v);
      }
    }
    if (timestamp == null || signatures.isEmpty()) return false;

    long now = clock.instant().getEpochSecond();
    if (Math.abs(now - timestamp) > toleranceSeconds) {
      log.warn("Stripe signature timestamp outside tolerance: t={} now={}", timestamp, now);
      return false;
    }

    byte[] expected = sign(webhookSecret, timestamp + "." + (rawBody == null ? "" : rawBody))
        .getBytes(StandardCharsets.UTF_8);
    for (String s : signatures) {
      if (MessageDigest.isEqual(expected, s.getBytes(StandardCharsets.UTF_8))) return true;
    }
    return false;
  }

  /**
   * Hex HMAC-SHA256, the v1 scheme.
   */
  public static String sign(String secret, String payload) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute HMAC SHA-256", e);
    }
  }
}
