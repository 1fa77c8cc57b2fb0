package com.vipgate.api.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ReconcilerJobsTest {

  private static final ZoneId KYIV = ZoneId.of("Europe/Kyiv");

  @Test
  void catchUpOnlyAfterTodaysSlot() {
    assertThat(ReconcilerJobs.catchUpDue(Instant.parse("2026-01-15T02:59:59Z"), ZoneId.of("UTC"), 3)).isFalse();
    assertThat(ReconcilerJobs.catchUpDue(Instant.parse("2026-01-15T03:00:00Z"), ZoneId.of("UTC"), 3)).isTrue();
    assertThat(ReconcilerJobs.catchUpDue(Instant.parse("2026-01-15T23:10:00Z"), ZoneId.of("UTC"), 3)).isTrue();
  }

  @Test
  void slotIsEvaluatedInConfiguredZone() {
    // 01:30 UTC is 03:30 in Kyiv during winter time
    Instant now = Instant.parse("2026-01-15T01:30:00Z");

    assertThat(ReconcilerJobs.catchUpDue(now, ZoneId.of("UTC"), 3)).isFalse();
    assertThat(ReconcilerJobs.catchUpDue(now, KYIV, 3)).isTrue();
  }
}
