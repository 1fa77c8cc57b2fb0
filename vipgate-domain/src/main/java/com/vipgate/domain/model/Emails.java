package com.vipgate.domain.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email normalization. The subscription table is keyed by the normalized form.
 */
public final class Emails {

  private static final Pattern SHAPE = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  private Emails() {}

  /**
   * Trimmed, lower-cased email or null when blank.
   */
  public static String normalize(String raw) {
    if (raw == null) return null;
    String v = raw.trim().toLowerCase(Locale.ROOT);
    return v.isEmpty() ? null : v;
  }

  public static boolean looksValid(String raw) {
    String v = normalize(raw);
    return v != null && SHAPE.matcher(v).matches();
  }
}
