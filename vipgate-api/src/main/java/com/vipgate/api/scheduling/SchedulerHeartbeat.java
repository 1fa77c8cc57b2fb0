package com.vipgate.api.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Records scheduler liveness in scheduler_heartbeats, one row per running instance.
 */
@Component
public class SchedulerHeartbeat {

  private static final Logger log = LoggerFactory.getLogger(SchedulerHeartbeat.class);

  private final JdbcTemplate jdbc;
  private final Clock clock;
  private final String instanceId;

  public SchedulerHeartbeat(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
    String host = System.getenv("HOSTNAME");
    this.instanceId = (host == null || host.isBlank() ? "local" : host.trim())
        + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  @Scheduled(fixedDelayString = "${vipgate.reconciler.heartbeat-ms:60000}")
  public void heartbeat() {
    Timestamp now = Timestamp.from(clock.instant());
    try {
      // UPDATE first, INSERT on first beat: portable across H2 and Postgres
      int updated = jdbc.update(
          "UPDATE scheduler_heartbeats SET last_heartbeat_at = ? WHERE instance_id = ?",
          now, instanceId
      );
      if (updated == 0) {
        jdbc.update(
            "INSERT INTO scheduler_heartbeats(instance_id, started_at, last_heartbeat_at) VALUES (?, ?, ?)",
            instanceId, now, now
        );
      }
    } catch (DataAccessException e) {
      log.warn("Heartbeat write failed: {}", e.getMessage());
    }
  }

  public Optional<Instant> lastHeartbeatAt() {
    Timestamp ts = jdbc.queryForObject("SELECT MAX(last_heartbeat_at) FROM scheduler_heartbeats", Timestamp.class);
    return Optional.ofNullable(ts).map(Timestamp::toInstant);
  }

  public String instanceId() {
    return instanceId;
  }
}
