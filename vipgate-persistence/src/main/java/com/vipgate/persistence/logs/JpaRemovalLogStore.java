package com.vipgate.persistence.logs;

import com.vipgate.application.ports.RemovalLogStore;
import com.vipgate.domain.sweep.RemovalLogEntry;
import com.vipgate.domain.sweep.RemovalLogStatus;
import com.vipgate.domain.sweep.RemovalReason;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class JpaRemovalLogStore implements RemovalLogStore {

  private final RemovalLogRepository logs;

  public JpaRemovalLogStore(RemovalLogRepository logs) {
    this.logs = logs;
  }

  @Override
  @Transactional
  public RemovalLogEntry append(RemovalLogEntry e) {
    RemovalLogEntity saved = logs.save(new RemovalLogEntity(
        e.sweepId(),
        e.email(),
        e.memberId(),
        e.reason().name(),
        e.status().name(),
        join(e.groupsRemoved()),
        join(e.groupsFailed()),
        e.notified(),
        e.error(),
        e.createdAt()
    ));
    return toEntry(saved);
  }

  @Override
  @Transactional(readOnly = true)
  public List<RemovalLogEntry> recent(int limit) {
    return logs.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit))).stream()
        .map(JpaRemovalLogStore::toEntry)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<RemovalLogEntry> recentByEmail(String email, int limit) {
    return logs.findByEmailOrderByIdDesc(email, PageRequest.of(0, Math.max(1, limit))).stream()
        .map(JpaRemovalLogStore::toEntry)
        .toList();
  }

  static String join(List<Long> ids) {
    if (ids == null || ids.isEmpty()) return null;
    return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
  }

  static List<Long> split(String csv) {
    List<Long> out = new ArrayList<>();
    if (csv == null || csv.isBlank()) return out;
    for (String part : csv.split(",")) {
      String p = part.trim();
      if (!p.isEmpty()) out.add(Long.parseLong(p));
    }
    return out;
  }

  private static RemovalLogEntry toEntry(RemovalLogEntity e) {
    return new RemovalLogEntry(
        e.getId(),
        e.getSweepId(),
        e.getEmail(),
        e.getMemberId(),
        RemovalReason.valueOf(e.getReason()),
        RemovalLogStatus.valueOf(e.getStatus()),
        split(e.getGroupsRemoved()),
        split(e.getGroupsFailed()),
        e.isNotified(),
        e.getError(),
        e.getCreatedAt()
    );
  }
}
