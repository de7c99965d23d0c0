package com.jay.valuator.model;

import com.jay.valuator.model.enums.ValuationMethod;

/** Normalised weight of one contributing method and the rule that produced it. */
public record MethodologyWeight(ValuationMethod method, double weight, String rationale) {}
