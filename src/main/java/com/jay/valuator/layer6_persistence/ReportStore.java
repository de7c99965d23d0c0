package com.jay.valuator.layer6_persistence;

import com.jay.valuator.model.AuditLog;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.ReportSummary;
import com.jay.valuator.model.ValuationReport;

import java.util.List;
import java.util.Optional;

/** Durable storage for finished reports and their audit rows. */
public interface ReportStore {

    /** Inserts or replaces the report; returns its id. */
    String save(ValuationReport report);

    Optional<ValuationReport> findById(String id);

    /** Newest first. */
    List<ReportSummary> list();

    /** @return false when no report had that id */
    boolean delete(String id);

    Optional<AuditLog> auditLog(String id);

    /**
     * Replaces the stored report's blended valuation (after a re-weight) and
     * its listed fair value. Empty when no report had that id.
     */
    Optional<ValuationReport> updateBlend(String id, BlendedValuation blended);
}
