package com.vipgate.domain.sweep;

import java.time.Instant;
import java.util.UUID;

/**
 * One advance-warning attempt. The milestone key is (subscriptionId, leadDays, expiresAt).
 */
public record WarningLogEntry(
    Long id,
    UUID subscriptionId,
    String email,
    String memberId,
    int leadDays,
    Instant expiresAt,
    WarningStatus status,
    String error,
    Instant createdAt
) {
}
