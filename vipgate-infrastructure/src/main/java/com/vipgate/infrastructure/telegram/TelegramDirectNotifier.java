package com.vipgate.infrastructure.telegram;

import com.vipgate.application.ports.NotificationException;
import com.vipgate.application.ports.NotifierPort;

import java.io.IOException;

/**
 * Direct messages to a member's private chat (chat id == user id).
 * Fails when the user never started the bot or blocked it.
 */
public class TelegramDirectNotifier implements NotifierPort {

  private final TelegramBotApi api;

  public TelegramDirectNotifier(TelegramBotApi api) {
    this.api = api;
  }

  @Override
  public void sendDirectMessage(long memberId, String text) throws NotificationException {
    try {
      api.sendMessage(memberId, text);
    } catch (IOException e) {
      throw new NotificationException("sendMessage to " + memberId + " failed: " + e.getMessage(), e);
    }
  }
}
