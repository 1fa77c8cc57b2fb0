package com.vipgate.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.vipgate.application.ports.InviteHandle;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.MembershipException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Telegram groups as the membership directory.
 *
 * Removal is ban followed by unban: the member leaves the group but can rejoin later through a
 * fresh invite after renewing.
 */
public class TelegramMembershipDirectory implements MembershipDirectoryPort {

  private static final Logger log = LoggerFactory.getLogger(TelegramMembershipDirectory.class);

  private final TelegramBotApi api;
  private final Clock clock;

  public TelegramMembershipDirectory(TelegramBotApi api, Clock clock) {
    this.api = api;
    this.clock = clock;
  }

  @Override
  public void removeMember(long groupId, long memberId) throws MembershipException {
    try {
      api.banChatMember(groupId, memberId);
    } catch (TelegramApiException e) {
      throw new MembershipException(e.getMessage(), e.isTransient());
    } catch (IOException e) {
      throw new MembershipException("banChatMember failed: " + e.getMessage(), e);
    }

    try {
      api.unbanChatMember(groupId, memberId);
    } catch (IOException e) {
      // member is out of the group; only rejoining is affected
      log.warn("Unban of {} in {} failed after removal: {}", memberId, groupId, e.getMessage());
    }
  }

  @Override
  public InviteHandle createInvite(long groupId, Duration ttl, int maxUses) throws MembershipException {
    Instant expireAt = ttl == null ? null : clock.instant().plus(ttl);
    try {
      JsonNode link = api.createChatInviteLink(groupId, expireAt, maxUses, "vip-access");
      String url = link.path("invite_link").asText(null);
      if (url == null || url.isBlank()) {
        throw new MembershipException("createChatInviteLink returned no link", false);
      }
      Instant expires = link.hasNonNull("expire_date")
          ? Instant.ofEpochSecond(link.get("expire_date").asLong())
          : expireAt;
      return new InviteHandle(url, expires, link.path("member_limit").asInt(maxUses));
    } catch (TelegramApiException e) {
      throw new MembershipException(e.getMessage(), e.isTransient());
    } catch (IOException e) {
      throw new MembershipException("createChatInviteLink failed: " + e.getMessage(), e);
    }
  }
}
