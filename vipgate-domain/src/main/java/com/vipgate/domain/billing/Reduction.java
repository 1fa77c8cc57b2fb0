package com.vipgate.domain.billing;

import com.vipgate.domain.model.SubscriptionRecord;

/**
 * Result of folding one event onto the current record.
 *
 * @param record     next state; the unchanged input for UNCHANGED, null for IGNORED without a target
 * @param change     classification
 * @param reason     short machine-readable note for IGNORED / UNCHANGED outcomes
 * @param planSource how the plan was inferred, null for events that carry no plan
 */
public record Reduction(
    SubscriptionRecord record,
    ChangeKind change,
    String reason,
    PlanResolution.Source planSource
) {

  static Reduction of(SubscriptionRecord record, ChangeKind change) {
    return new Reduction(record, change, null, null);
  }

  static Reduction unchanged(SubscriptionRecord record, String reason) {
    return new Reduction(record, ChangeKind.UNCHANGED, reason, null);
  }

  static Reduction ignored(SubscriptionRecord current, String reason) {
    return new Reduction(current, ChangeKind.IGNORED, reason, null);
  }

  Reduction withPlanSource(PlanResolution.Source source) {
    return new Reduction(record, change, reason, source);
  }
}
