package com.vipgate.api.scheduling;

import com.vipgate.api.config.ReconcilerProperties;
import com.vipgate.application.ports.ProcessedEventStore;
import com.vipgate.application.sweep.SweepEngine;
import com.vipgate.application.warning.ExpiryWarningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Daily reconciler jobs. Cron hours and zone come from vipgate.reconciler.*.
 *
 * Job bodies never throw: a failed run is logged and the next slot tries again.
 */
@Component
public class ReconcilerJobs {

  private static final Logger log = LoggerFactory.getLogger(ReconcilerJobs.class);

  private final SweepEngine sweeps;
  private final ExpiryWarningService warnings;
  private final ProcessedEventStore processedEvents;
  private final ReconcilerProperties props;
  private final Clock clock;

  public ReconcilerJobs(
      SweepEngine sweeps,
      ExpiryWarningService warnings,
      ProcessedEventStore processedEvents,
      ReconcilerProperties props,
      Clock clock
  ) {
    this.sweeps = sweeps;
    this.warnings = warnings;
    this.processedEvents = processedEvents;
    this.props = props;
    this.clock = clock;
  }

  @Scheduled(cron = "0 0 ${vipgate.reconciler.sweep-hour:3} * * *", zone = "${vipgate.reconciler.timezone:UTC}")
  public void dailySweep() {
    runSweep("scheduler");
  }

  /**
   * One sweep after startup, so a deploy or restart across the daily slot does not skip a day.
   */
  @EventListener(ApplicationReadyEvent.class)
  public void catchUpSweep() {
    if (!props.catchUpOnStart()) return;
    ZoneId zone = props.zone();
    if (!catchUpDue(clock.instant(), zone, props.sweepHour())) {
      log.info("Skipping catch-up sweep: today's {}:00 {} slot has not passed yet", props.sweepHour(), zone);
      return;
    }
    runSweep("catch-up");
  }

  /**
   * True once today's sweep slot has passed in the given zone.
   */
  static boolean catchUpDue(Instant now, ZoneId zone, int sweepHour) {
    return now.atZone(zone).getHour() >= sweepHour;
  }

  @Scheduled(cron = "0 0 ${vipgate.reconciler.notification-hour:10} * * *",
      zone = "${vipgate.reconciler.timezone:UTC}")
  public void dailyWarnings() {
    try {
      warnings.run();
    } catch (RuntimeException e) {
      log.error("Expiry warning pass failed", e);
    }
  }

  @Scheduled(cron = "0 30 4 * * *", zone = "${vipgate.reconciler.timezone:UTC}")
  public void purgeProcessedEvents() {
    Instant cutoff = clock.instant().minus(Duration.ofDays(props.processedEventRetentionDays()));
    try {
      int n = processedEvents.purgeOlderThan(cutoff);
      log.info("Purged {} processed event id(s) received before {}", n, cutoff);
    } catch (RuntimeException e) {
      log.error("Processed event purge failed", e);
    }
  }

  private void runSweep(String source) {
    try {
      sweeps.trigger(source);
    } catch (RuntimeException e) {
      log.error("Sweep ({}) failed", source, e);
    }
  }
}
