package com.jay.valuator.model;

/** One (WACC, terminal growth) point of the DCF sensitivity grid. Rates 4dp, EV 2dp. */
public record SensitivityCell(double wacc, double terminalGrowthRate, double enterpriseValue) {}
