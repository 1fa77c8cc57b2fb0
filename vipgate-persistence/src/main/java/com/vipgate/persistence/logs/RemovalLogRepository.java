package com.vipgate.persistence.logs;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RemovalLogRepository extends JpaRepository<RemovalLogEntity, Long> {

  List<RemovalLogEntity> findAllByOrderByIdDesc(Pageable page);

  List<RemovalLogEntity> findByEmailOrderByIdDesc(String email, Pageable page);
}
