package com.vipgate.application.notify;

import com.vipgate.application.config.ReconcilerSettings;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Direct-message texts sent to members. Plain text, no markup, so every transport can send them.
 */
public final class MessageTemplates {

  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);

  private final ReconcilerSettings settings;

  public MessageTemplates(ReconcilerSettings settings) {
    this.settings = settings;
  }

  public String removalNotice() {
    StringBuilder sb = new StringBuilder();
    sb.append("Your VIP subscription has ended and your access to the VIP groups was removed.");
    if (settings.renewUrl() != null) {
      sb.append("\n\nRenew here to get back in: ").append(settings.renewUrl());
    }
    appendSupport(sb);
    return sb.toString();
  }

  public String expiryWarning(int leadDays, Instant expiresAt) {
    StringBuilder sb = new StringBuilder();
    if (leadDays == 0) {
      sb.append("Your VIP subscription expires today");
    } else if (leadDays == 1) {
      sb.append("Your VIP subscription expires tomorrow");
    } else {
      sb.append("Your VIP subscription expires in ").append(leadDays).append(" days");
    }
    sb.append(" (").append(DATE.format(expiresAt.atZone(settings.zone()))).append(").");
    if (settings.renewUrl() != null) {
      sb.append("\n\nRenew now to keep your access: ").append(settings.renewUrl());
    }
    appendSupport(sb);
    return sb.toString();
  }

  private void appendSupport(StringBuilder sb) {
    if (settings.supportContact() != null) {
      sb.append("\nQuestions? Contact ").append(settings.supportContact());
    }
  }
}
