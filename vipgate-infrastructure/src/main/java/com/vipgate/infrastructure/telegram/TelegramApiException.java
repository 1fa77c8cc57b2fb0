package com.vipgate.infrastructure.telegram;

import java.io.IOException;

/**
 * Telegram answered {@code ok=false}, a non-2xx status, or an unreadable body.
 */
public class TelegramApiException extends IOException {

  private final int errorCode;

  public TelegramApiException(int errorCode, String description) {
    super("Telegram error " + errorCode + ": " + description);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  /**
   * 429 and 5xx are worth retrying later; 400/403 are permanent for this request.
   */
  public boolean isTransient() {
    return errorCode == 429 || errorCode >= 500;
  }
}
