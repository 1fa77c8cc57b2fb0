package com.vipgate.application.ports;

import java.time.Duration;

/**
 * The group platform. Every call is bounded by the adapter's own timeouts.
 */
public interface MembershipDirectoryPort {

  /**
   * Removes the member from the group without banning them permanently.
   * Removing someone who is not a member succeeds.
   */
  void removeMember(long groupId, long memberId) throws MembershipException;

  InviteHandle createInvite(long groupId, Duration ttl, int maxUses) throws MembershipException;
}
