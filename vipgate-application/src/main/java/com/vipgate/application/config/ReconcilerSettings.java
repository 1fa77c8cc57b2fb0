package com.vipgate.application.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Reconciler configuration, built once at startup and passed to services by constructor.
 *
 * - gracePeriod: how long past expiry an ACTIVE member keeps access
 * - sweepHour / notificationHour: local hour (0..23) in {@code zone}
 * - groupIds: managed groups; removals and invites fan out to all of them
 * - warningLeadDays: days before expiry at which a reminder is sent (0 = expiry day)
 */
public record ReconcilerSettings(
    Duration gracePeriod,
    int sweepHour,
    int notificationHour,
    ZoneId zone,
    boolean autoRemovalEnabled,
    boolean fallbackInviteEnabled,
    String fallbackInviteLink,
    List<Long> groupIds,
    List<Integer> warningLeadDays,
    Duration inviteTtl,
    Duration inviteCooldown,
    String renewUrl,
    String supportContact
) {

  public static final List<Integer> DEFAULT_LEAD_DAYS = List.of(7, 3, 1, 0);

  public ReconcilerSettings {
    Objects.requireNonNull(gracePeriod, "gracePeriod");
    if (gracePeriod.isNegative()) {
      throw new IllegalArgumentException("gracePeriod must be >= 0");
    }
    requireHour(sweepHour, "sweepHour");
    requireHour(notificationHour, "notificationHour");
    zone = zone == null ? ZoneId.of("UTC") : zone;
    groupIds = groupIds == null ? List.of() : List.copyOf(groupIds);
    warningLeadDays = warningLeadDays == null || warningLeadDays.isEmpty()
        ? DEFAULT_LEAD_DAYS
        : List.copyOf(warningLeadDays);
    for (Integer d : warningLeadDays) {
      if (d == null || d < 0) throw new IllegalArgumentException("warningLeadDays must be >= 0: " + warningLeadDays);
    }
    inviteTtl = inviteTtl == null ? Duration.ofHours(24) : inviteTtl;
    inviteCooldown = inviteCooldown == null ? Duration.ZERO : inviteCooldown;
    fallbackInviteLink = blankToNull(fallbackInviteLink);
    renewUrl = blankToNull(renewUrl);
    supportContact = blankToNull(supportContact);
  }

  public static ReconcilerSettings defaults() {
    return new ReconcilerSettings(Duration.ofDays(3), 3, 10, ZoneId.of("UTC"), true, false, null,
        List.of(), DEFAULT_LEAD_DAYS, Duration.ofHours(24), Duration.ofMinutes(5), null, null);
  }

  public boolean hasFallbackInvite() {
    return fallbackInviteEnabled && fallbackInviteLink != null;
  }

  public ReconcilerSettings withGroupIds(List<Long> ids) {
    return new ReconcilerSettings(gracePeriod, sweepHour, notificationHour, zone, autoRemovalEnabled,
        fallbackInviteEnabled, fallbackInviteLink, ids, warningLeadDays, inviteTtl, inviteCooldown, renewUrl,
        supportContact);
  }

  public ReconcilerSettings withAutoRemovalEnabled(boolean enabled) {
    return new ReconcilerSettings(gracePeriod, sweepHour, notificationHour, zone, enabled,
        fallbackInviteEnabled, fallbackInviteLink, groupIds, warningLeadDays, inviteTtl, inviteCooldown, renewUrl,
        supportContact);
  }

  public ReconcilerSettings withFallbackInvite(boolean enabled, String link) {
    return new ReconcilerSettings(gracePeriod, sweepHour, notificationHour, zone, autoRemovalEnabled,
        enabled, link, groupIds, warningLeadDays, inviteTtl, inviteCooldown, renewUrl, supportContact);
  }

  private static void requireHour(int h, String name) {
    if (h < 0 || h > 23) throw new IllegalArgumentException(name + " must be in 0..23, got " + h);
  }

  private static String blankToNull(String v) {
    return v == null || v.isBlank() ? null : v.trim();
  }
}
