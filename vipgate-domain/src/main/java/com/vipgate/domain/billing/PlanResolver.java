package com.vipgate.domain.billing;

import com.vipgate.domain.model.PlanType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps an invoice line to a plan.
 *
 * Order:
 * - configured price id mapping
 * - best-effort keyword match on the line description ("month", "quarter", "year" families)
 *
 * The returned {@link PlanResolution#source()} tells callers when the heuristic was used so a
 * missing price mapping does not go unnoticed.
 */
public final class PlanResolver {

  private final Map<String, PlanType> byPriceId;

  public PlanResolver(Map<String, PlanType> priceIds) {
    Map<String, PlanType> m = new HashMap<>();
    if (priceIds != null) {
      priceIds.forEach((k, v) -> {
        if (k != null && !k.isBlank() && v != null && v != PlanType.UNKNOWN) {
          m.put(k.trim(), v);
        }
      });
    }
    this.byPriceId = Map.copyOf(m);
  }

  public static PlanResolver of(String monthlyPriceId, String quarterlyPriceId, String annualPriceId) {
    Map<String, PlanType> m = new HashMap<>();
    if (monthlyPriceId != null) m.put(monthlyPriceId, PlanType.MONTHLY);
    if (quarterlyPriceId != null) m.put(quarterlyPriceId, PlanType.QUARTERLY);
    if (annualPriceId != null) m.put(annualPriceId, PlanType.ANNUAL);
    return new PlanResolver(m);
  }

  public PlanResolution resolve(String priceId, String lineDescription) {
    if (priceId != null && !priceId.isBlank()) {
      PlanType mapped = byPriceId.get(priceId.trim());
      if (mapped != null) return new PlanResolution(mapped, PlanResolution.Source.PRICE_ID);
    }

    PlanType guessed = fromDescription(lineDescription);
    if (guessed != PlanType.UNKNOWN) {
      return new PlanResolution(guessed, PlanResolution.Source.DESCRIPTION_HEURISTIC);
    }
    return PlanResolution.none();
  }

  static PlanType fromDescription(String description) {
    if (description == null || description.isBlank()) return PlanType.UNKNOWN;
    String d = description.toLowerCase(Locale.ROOT);
    if (d.contains("monthly") || d.contains("month")) return PlanType.MONTHLY;
    if (d.contains("quarterly") || d.contains("quarter")) return PlanType.QUARTERLY;
    if (d.contains("annual") || d.contains("yearly") || d.contains("year")) return PlanType.ANNUAL;
    return PlanType.UNKNOWN;
  }
}
