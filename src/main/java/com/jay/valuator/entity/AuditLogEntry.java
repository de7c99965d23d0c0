package com.jay.valuator.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_log_entries", indexes = @Index(columnList = "valuationId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String valuationId;

    @Column(nullable = false)
    private String stepName;

    @Column(nullable = false)
    private String status;        // pending/running/completed/failed/skipped

    private Double durationMs;

    @Column(length = 2000)
    private String error;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
}
