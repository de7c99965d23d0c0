package com.jay.valuator.model;

import java.util.List;

/** Persisted step rows and language-model calls for one valuation. */
public record AuditLog(String valuationId, List<PipelineStep> steps, List<LlmCallLog> llmCalls) {}
