package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.valuator.model.enums.StepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineStep {
    private String stepName;
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double durationMs;
    private String error;
}
