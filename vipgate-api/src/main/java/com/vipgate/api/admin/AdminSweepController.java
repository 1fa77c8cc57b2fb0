package com.vipgate.api.admin;

import com.vipgate.api.admin.AdminSubscriptionController.SubscriptionRow;
import com.vipgate.application.sweep.GracePeriodSweeper;
import com.vipgate.application.sweep.SweepCandidate;
import com.vipgate.application.sweep.SweepEngine;
import com.vipgate.application.sweep.SweepReport;
import com.vipgate.application.sweep.SweepRun;
import com.vipgate.application.warning.ExpiryWarningService;
import com.vipgate.application.warning.WarningReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual triggers and read-only views of the reconciliation jobs.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminSweepController {

  private final SweepEngine engine;
  private final GracePeriodSweeper sweeper;
  private final ExpiryWarningService warnings;
  private final AdminAuditService audit;

  public AdminSweepController(SweepEngine engine, GracePeriodSweeper sweeper, ExpiryWarningService warnings,
                              AdminAuditService audit) {
    this.engine = engine;
    this.sweeper = sweeper;
    this.warnings = warnings;
    this.audit = audit;
  }

  public record CandidateRow(SubscriptionRow subscription, String reason, String plannedAction) {}

  @PostMapping("/sweep/run")
  public Map<String, Object> runSweep() {
    SweepRun run = engine.trigger("admin");
    audit.logAdmin("SWEEP_TRIGGER", "SWEEP", run.report() == null ? run.status().name() : run.report().sweepId(),
        run.report() == null ? null : "removed=" + run.report().removed() + " failed=" + run.report().failed());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("run", run.status().name());
    body.put("report", run.report() == null ? null : report(run.report()));
    return body;
  }

  @GetMapping("/sweep/status")
  public Map<String, Object> status() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("running", engine.isRunning());
    body.put("lastCompletedAt", engine.lastCompletedAt().map(Object::toString).orElse(null));
    body.put("lastReport", engine.lastReport().map(AdminSweepController::report).orElse(null));
    return body;
  }

  @GetMapping("/sweep/grace")
  public List<SubscriptionRow> inGracePeriod() {
    return sweeper.inGracePeriod().stream().map(SubscriptionRow::of).toList();
  }

  @GetMapping("/sweep/preview")
  public List<CandidateRow> preview() {
    return sweeper.preview().stream().map(AdminSweepController::candidate).toList();
  }

  @PostMapping("/warnings/run")
  public Map<String, Object> runWarnings() {
    WarningReport r = warnings.run();
    audit.logAdmin("WARNINGS_TRIGGER", "WARNINGS", null, "sent=" + r.sent() + " failed=" + r.failed());
    return Map.of(
        "status", "ok",
        "sent", r.sent(),
        "failed", r.failed(),
        "alreadySent", r.alreadySent()
    );
  }

  private static CandidateRow candidate(SweepCandidate c) {
    return new CandidateRow(SubscriptionRow.of(c.record()), c.reason().name(), c.plannedAction().name());
  }

  private static Map<String, Object> report(SweepReport r) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("sweepId", r.sweepId());
    m.put("startedAt", r.startedAt().toString());
    m.put("finishedAt", r.finishedAt().toString());
    m.put("candidates", r.candidates());
    m.put("removed", r.removed());
    m.put("failed", r.failed());
    m.put("whitelisted", r.whitelisted());
    m.put("skipped", r.skipped());
    m.put("errors", r.errors());
    return m;
  }
}
