package com.vipgate.domain.billing;

import com.vipgate.domain.model.PlanType;

/**
 * Outcome of plan inference together with the path that produced it.
 */
public record PlanResolution(PlanType plan, Source source) {

  public enum Source {
    PRICE_ID,
    DESCRIPTION_HEURISTIC,
    NONE
  }

  public static PlanResolution none() {
    return new PlanResolution(PlanType.UNKNOWN, Source.NONE);
  }

  public boolean isKnown() {
    return plan != PlanType.UNKNOWN;
  }
}
