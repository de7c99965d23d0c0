package com.jay.valuator.repository;

import com.jay.valuator.entity.AuditLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogEntryRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findByValuationIdOrderByIdAsc(String valuationId);

    @Modifying
    @Query("DELETE FROM AuditLogEntry a WHERE a.valuationId = :valuationId")
    int deleteByValuationId(String valuationId);
}
