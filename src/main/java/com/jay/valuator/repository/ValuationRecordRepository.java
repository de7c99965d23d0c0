package com.jay.valuator.repository;

import com.jay.valuator.entity.ValuationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ValuationRecordRepository extends JpaRepository<ValuationRecord, String> {

    List<ValuationRecord> findAllByOrderByCreatedAtDesc();
}
