package com.jay.valuator.model;

import com.jay.valuator.model.enums.StepStatus;

import java.time.LocalDateTime;

/** Wire form of one step transition. Appended to a run's event bus, never mutated. */
public record StepEvent(String step, StepStatus status, LocalDateTime timestamp, Double durationMs, String error) {

    public static StepEvent of(String step, StepStatus status) {
        return new StepEvent(step, status, LocalDateTime.now(), null, null);
    }

    public static StepEvent of(PipelineStep step) {
        return new StepEvent(step.getStepName(), step.getStatus(), LocalDateTime.now(),
            step.getDurationMs(), step.getError());
    }
}
