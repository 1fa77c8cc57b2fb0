package com.vipgate.application.ports;

import java.time.Instant;

/**
 * @param expiresAt null when the platform did not report one
 */
public record InviteHandle(String link, Instant expiresAt, int memberLimit) {}
