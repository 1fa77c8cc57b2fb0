package com.vipgate.application.ports;

import com.vipgate.domain.model.WhitelistEntry;

import java.util.List;
import java.util.Optional;

public interface WhitelistStore {

  /**
   * Entry matching the member id, or else one whose email matches. Either argument may be null.
   */
  Optional<WhitelistEntry> match(String memberId, String email);

  List<WhitelistEntry> findAll();

  WhitelistEntry save(WhitelistEntry entry);

  boolean delete(String memberId);
}
