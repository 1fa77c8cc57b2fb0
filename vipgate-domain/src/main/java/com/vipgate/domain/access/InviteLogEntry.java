package com.vipgate.domain.access;

import java.time.Instant;
import java.util.UUID;

/**
 * An invite handed out for an email.
 *
 * @param groupId   null for the static fallback link
 * @param temporary false for the shared fallback link
 */
public record InviteLogEntry(
    UUID id,
    String email,
    String memberId,
    Long groupId,
    String inviteLink,
    int memberLimit,
    boolean temporary,
    Instant expiresAt,
    Instant createdAt
) {
}
