package com.vipgate.application.access;

import com.vipgate.domain.access.InviteLogEntry;

import java.util.List;

/**
 * @param invites links to hand to the member; empty unless GRANTED or COOLDOWN
 */
public record UnlockResult(Outcome outcome, List<InviteLogEntry> invites, String reason) {

  public enum Outcome {
    GRANTED,
    /** Invites were issued recently; the same links are returned. */
    COOLDOWN,
    DENIED,
    /** Entitled, but no invite could be created and no fallback is configured. */
    UNAVAILABLE
  }

  public UnlockResult {
    invites = invites == null ? List.of() : List.copyOf(invites);
  }

  static UnlockResult denied(String reason) {
    return new UnlockResult(Outcome.DENIED, List.of(), reason);
  }
}
