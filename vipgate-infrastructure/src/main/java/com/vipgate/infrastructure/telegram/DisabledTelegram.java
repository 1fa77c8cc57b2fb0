package com.vipgate.infrastructure.telegram;

import com.vipgate.application.ports.InviteHandle;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.MembershipException;
import com.vipgate.application.ports.NotificationException;
import com.vipgate.application.ports.NotifierPort;

import java.time.Duration;

/**
 * Used when Telegram is switched off. Every call fails, so sweeps log FAILED and retry once the
 * integration is enabled again.
 *
 * Two separate types so a container never sees one instance under both port types.
 */
public final class DisabledTelegram {

  static final String DISABLED = "telegram integration disabled";

  private DisabledTelegram() {}

  public static MembershipDirectoryPort directory() {
    return new Directory();
  }

  public static NotifierPort notifier() {
    return new Notifier();
  }

  static final class Directory implements MembershipDirectoryPort {

    @Override
    public void removeMember(long groupId, long memberId) throws MembershipException {
      throw new MembershipException(DISABLED, false);
    }

    @Override
    public InviteHandle createInvite(long groupId, Duration ttl, int maxUses) throws MembershipException {
      throw new MembershipException(DISABLED, false);
    }
  }

  static final class Notifier implements NotifierPort {

    @Override
    public void sendDirectMessage(long memberId, String text) throws NotificationException {
      throw new NotificationException(DISABLED);
    }
  }
}
