package com.jay.valuator.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** One stored valuation. The full report lives in {@code reportJson}; the other columns serve listings. */
@Entity
@Table(name = "valuation_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValuationRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String companyName;

    private Double fairValue;     // null when the run produced no valuation

    @Lob
    @Column(nullable = false, columnDefinition = "CLOB")
    private String reportJson;

    private LocalDateTime createdAt;
}
