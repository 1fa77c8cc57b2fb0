package com.vipgate.persistence.whitelist;

import com.vipgate.application.ports.WhitelistStore;
import com.vipgate.domain.model.Emails;
import com.vipgate.domain.model.WhitelistEntry;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
public class JpaWhitelistStore implements WhitelistStore {

  private final WhitelistRepository whitelist;

  public JpaWhitelistStore(WhitelistRepository whitelist) {
    this.whitelist = whitelist;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<WhitelistEntry> match(String memberId, String email) {
    Optional<WhitelistEntity> hit = memberId == null || memberId.isBlank()
        ? Optional.empty()
        : whitelist.findById(memberId.trim());
    String normalized = Emails.normalize(email);
    if (hit.isEmpty() && normalized != null) {
      hit = whitelist.findFirstByEmail(normalized);
    }
    return hit.map(JpaWhitelistStore::toEntry);
  }

  @Override
  @Transactional(readOnly = true)
  public List<WhitelistEntry> findAll() {
    return whitelist.findAllByOrderByCreatedAtDesc().stream().map(JpaWhitelistStore::toEntry).toList();
  }

  @Override
  @Transactional
  public WhitelistEntry save(WhitelistEntry e) {
    return toEntry(whitelist.save(new WhitelistEntity(e.memberId(), Emails.normalize(e.email()), e.reason(),
        e.addedBy(), e.createdAt())));
  }

  @Override
  @Transactional
  public boolean delete(String memberId) {
    if (!whitelist.existsById(memberId)) return false;
    whitelist.deleteById(memberId);
    return true;
  }

  private static WhitelistEntry toEntry(WhitelistEntity e) {
    return new WhitelistEntry(e.getMemberId(), e.getEmail(), e.getReason(), e.getAddedBy(), e.getCreatedAt());
  }
}
