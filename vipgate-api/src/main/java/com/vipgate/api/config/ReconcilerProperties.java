package com.vipgate.api.config;

import com.vipgate.application.config.ReconcilerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Reconciler schedule and policy.
 *
 * Env overrides follow the usual relaxed binding, e.g. VIPGATE_RECONCILER_GROUP_IDS=-100123,-100456.
 */
@ConfigurationProperties(prefix = "vipgate.reconciler")
public record ReconcilerProperties(

    @DefaultValue("3") int gracePeriodDays,

    @DefaultValue("3") int sweepHour,

    @DefaultValue("10") int notificationHour,

    @DefaultValue("UTC") String timezone,

    @DefaultValue("true") boolean autoRemovalEnabled,

    /**
     * Serve the static link below when no per-member invite can be created.
     */
    @DefaultValue("false") boolean fallbackInviteEnabled,

    String fallbackInviteLink,

    List<Long> groupIds,

    @DefaultValue({"7", "3", "1", "0"}) List<Integer> warningLeadDays,

    @DefaultValue("24") int inviteTtlHours,

    @DefaultValue("300") long inviteCooldownSeconds,

    @DefaultValue("90") int processedEventRetentionDays,

    @DefaultValue("60000") long heartbeatMs,

    /**
     * Run one sweep right after startup to cover a missed daily slot.
     */
    @DefaultValue("true") boolean catchUpOnStart

) {

  public ZoneId zone() {
    return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone.trim());
  }

  public ReconcilerSettings toSettings(String renewUrl, String supportContact) {
    return new ReconcilerSettings(
        Duration.ofDays(gracePeriodDays),
        sweepHour,
        notificationHour,
        zone(),
        autoRemovalEnabled,
        fallbackInviteEnabled,
        fallbackInviteLink,
        groupIds,
        warningLeadDays,
        Duration.ofHours(inviteTtlHours),
        Duration.ofSeconds(inviteCooldownSeconds),
        renewUrl,
        supportContact
    );
  }
}
