package com.vipgate.persistence.events;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, String> {

  @Modifying
  @Query("delete from ProcessedEventEntity e where e.receivedAt < :cutoff")
  int deleteReceivedBefore(@Param("cutoff") Instant cutoff);
}
