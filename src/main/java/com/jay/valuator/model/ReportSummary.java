package com.jay.valuator.model;

import java.time.LocalDateTime;

public record ReportSummary(String id, String companyName, Double fairValue, LocalDateTime createdAt) {}
