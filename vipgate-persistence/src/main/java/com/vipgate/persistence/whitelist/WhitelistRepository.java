package com.vipgate.persistence.whitelist;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WhitelistRepository extends JpaRepository<WhitelistEntity, String> {

  Optional<WhitelistEntity> findFirstByEmail(String email);

  List<WhitelistEntity> findAllByOrderByCreatedAtDesc();
}
