package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Full prompt/response record of one language-model call, kept for the audit trail. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmCallLog {
    private String stepName;
    private String model;
    private String systemPrompt;
    private String userPrompt;
    private String response;
    private Integer tokensUsed;
    private double durationMs;
    private LocalDateTime timestamp;
}
