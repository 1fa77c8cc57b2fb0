package com.vipgate.domain.model;

/**
 * Helpers for platform member identifiers (Telegram numeric user ids).
 */
public final class MemberIds {

  private MemberIds() {}

  /**
   * Keeps only the digits of a free-text value; null when nothing is left.
   * Checkout custom fields arrive as "@name 12345" or "id: 12345".
   */
  public static String digitsOnly(String raw) {
    if (raw == null) return null;
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c >= '0' && c <= '9') sb.append(c);
    }
    return sb.length() == 0 ? null : sb.toString();
  }

  public static boolean isPresent(String memberId) {
    return memberId != null && !memberId.isBlank();
  }

  /**
   * A member id the directory can act on: a positive decimal number that fits in a long.
   */
  public static boolean isValid(String memberId) {
    if (!isPresent(memberId)) return false;
    String v = memberId.trim();
    if (v.length() > 19) return false;
    for (int i = 0; i < v.length(); i++) {
      if (!Character.isDigit(v.charAt(i))) return false;
    }
    try {
      return Long.parseLong(v) > 0;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
