package com.vipgate.api.health;

import com.vipgate.api.scheduling.SchedulerHeartbeat;
import com.vipgate.application.sweep.SweepEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final JdbcTemplate jdbc;
  private final SweepEngine sweeps;
  private final SchedulerHeartbeat heartbeat;

  public HealthController(JdbcTemplate jdbc, SweepEngine sweeps, SchedulerHeartbeat heartbeat) {
    this.jdbc = jdbc;
    this.sweeps = sweeps;
    this.heartbeat = heartbeat;
  }

  @GetMapping("/api/v1/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    boolean dbUp;
    String lastHeartbeatAt = null;
    try {
      jdbc.queryForObject("SELECT 1", Integer.class);
      lastHeartbeatAt = heartbeat.lastHeartbeatAt().map(Object::toString).orElse(null);
      dbUp = true;
    } catch (DataAccessException e) {
      log.warn("Health check: database unavailable: {}", e.getMessage());
      dbUp = false;
    }

    body.put("status", dbUp ? "ok" : "degraded");
    body.put("service", "vipgate-api");
    body.put("db", dbUp ? "up" : "down");
    body.put("lastSweepAt", sweeps.lastCompletedAt().map(Object::toString).orElse(null));
    body.put("lastHeartbeatAt", lastHeartbeatAt);
    return ResponseEntity.status(dbUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
