package com.jay.valuator.repository;

import com.jay.valuator.entity.LlmCallRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LlmCallRecordRepository extends JpaRepository<LlmCallRecord, Long> {

    List<LlmCallRecord> findByValuationIdOrderByIdAsc(String valuationId);

    @Modifying
    @Query("DELETE FROM LlmCallRecord c WHERE c.valuationId = :valuationId")
    int deleteByValuationId(String valuationId);
}
