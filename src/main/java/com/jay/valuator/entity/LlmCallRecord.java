package com.jay.valuator.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "llm_call_records", indexes = @Index(columnList = "valuationId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmCallRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String valuationId;

    @Column(nullable = false)
    private String stepName;

    private String model;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String systemPrompt;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String userPrompt;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String response;

    private Integer tokensUsed;
    private Double durationMs;
    private LocalDateTime calledAt;
}
