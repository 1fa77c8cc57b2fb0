package com.vipgate.application.sweep;

import com.vipgate.domain.model.SubscriptionRecord;
import com.vipgate.domain.sweep.RemovalLogStatus;
import com.vipgate.domain.sweep.RemovalReason;

/**
 * Dry-run view of a removal candidate.
 *
 * @param plannedAction PROCESSING when the next sweep would attempt a removal, otherwise the status it
 *                      would log instead
 */
public record SweepCandidate(SubscriptionRecord record, RemovalReason reason, RemovalLogStatus plannedAction) {}
