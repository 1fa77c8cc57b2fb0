package com.vipgate.persistence.invite;

import com.vipgate.application.ports.InviteLogStore;
import com.vipgate.domain.access.InviteLogEntry;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Component
public class JpaInviteLogStore implements InviteLogStore {

  private final InviteLogRepository invites;

  public JpaInviteLogStore(InviteLogRepository invites) {
    this.invites = invites;
  }

  @Override
  @Transactional
  public InviteLogEntry append(InviteLogEntry e) {
    return toEntry(invites.save(new InviteLogEntity(e.id(), e.email(), e.memberId(), e.groupId(), e.inviteLink(),
        e.memberLimit(), e.temporary(), e.expiresAt(), e.createdAt())));
  }

  @Override
  @Transactional(readOnly = true)
  public List<InviteLogEntry> findIssuedSince(String email, Instant since) {
    return invites.findByEmailAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(email, since).stream()
        .map(JpaInviteLogStore::toEntry)
        .toList();
  }

  private static InviteLogEntry toEntry(InviteLogEntity e) {
    return new InviteLogEntry(e.getId(), e.getEmail(), e.getMemberId(), e.getGroupId(), e.getInviteLink(),
        e.getMemberLimit(), e.isTemporary(), e.getExpiresAt(), e.getCreatedAt());
  }
}
