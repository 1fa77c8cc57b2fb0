package com.vipgate.api.config;

import com.vipgate.domain.billing.PlanResolver;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Stripe webhook and price mapping.
 *
 * IMPORTANT:
 * - webhookSecret must come from env (VIPGATE_BILLING_WEBHOOK_SECRET)
 * - an empty secret disables signature checks, local use only
 */
@ConfigurationProperties(prefix = "vipgate.billing")
public record BillingProperties(

    String webhookSecret,

    @DefaultValue("300") long signatureToleranceSeconds,

    String priceMonthly,

    String priceQuarterly,

    String priceAnnual,

    String renewUrl

) {

  public PlanResolver planResolver() {
    return PlanResolver.of(priceMonthly, priceQuarterly, priceAnnual);
  }
}
